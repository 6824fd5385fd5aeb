package com.metallisense.orchestrator.pipeline;

import com.metallisense.common.anomaly.AnomalyEvaluator;
import com.metallisense.common.audit.DecisionRecordSink;
import com.metallisense.common.correction.CorrectionRecommender;
import com.metallisense.common.exception.ModelNotReadyException;
import com.metallisense.common.model.AnalysisResult;
import com.metallisense.common.model.AnomalyOutcome;
import com.metallisense.common.model.AnomalyResult;
import com.metallisense.common.model.Composition;
import com.metallisense.common.model.CorrectionOutcome;
import com.metallisense.common.model.CorrectionResult;
import com.metallisense.common.model.DecisionRecord;
import com.metallisense.common.model.StageResponse;
import com.metallisense.common.policy.DecisionPolicy;
import com.metallisense.orchestrator.logger.DecisionFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Sequences the analysis stages for one request.
 *
 * <h3>Stage order</h3>
 * <ol>
 *   <li>Anomaly evaluation against the requested grade (always) → audit {@code ANOMALY_CHECK}</li>
 *   <li>{@link DecisionPolicy#shouldRecommendAlloy} gate on the anomaly severity</li>
 *   <li>Alloy correction when the gate opens → audit {@code ALLOY_RECOMMENDATION};
 *       otherwise a "not invoked" placeholder → audit {@code ALLOY_RECOMMENDATION_SKIPPED}</li>
 *   <li>Policy validation of each produced output (failures are tagged, not dropped)</li>
 *   <li>Aggregation with the constant safety note and a timestamp</li>
 * </ol>
 *
 * <p>Stages never call each other; only this class decides what runs. Any failure
 * inside a stage is caught here and replaced by an ERROR-tagged result for that
 * stage, so a request never aborts because one stage failed. Execution within a
 * request is synchronous; the class holds no per-request state and is safe to share.
 */
@Component
public class AnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    public static final String ANOMALY_CHECK                = "ANOMALY_CHECK";
    public static final String ALLOY_RECOMMENDATION         = "ALLOY_RECOMMENDATION";
    public static final String ALLOY_RECOMMENDATION_SKIPPED = "ALLOY_RECOMMENDATION_SKIPPED";

    static final String NOT_INVOKED_REASON =
        "Not invoked - anomaly severity below threshold (must be MEDIUM or HIGH)";

    private final PipelineContext context;
    private final AnomalyEvaluator anomalyEvaluator;
    private final CorrectionRecommender correctionRecommender;
    private final DecisionRecordSink auditSink;
    private final DecisionFlowLogger flowLogger;

    public AnalysisOrchestrator(PipelineContext context, AnomalyEvaluator anomalyEvaluator,
                                CorrectionRecommender correctionRecommender,
                                DecisionRecordSink auditSink, DecisionFlowLogger flowLogger) {
        this.context               = context;
        this.anomalyEvaluator      = anomalyEvaluator;
        this.correctionRecommender = correctionRecommender;
        this.auditSink             = auditSink;
        this.flowLogger            = flowLogger;
    }

    /**
     * Validates the raw composition, then runs the pipeline.
     *
     * @throws com.metallisense.common.exception.InvalidCompositionException before any stage runs
     */
    public AnalysisResult analyze(Map<String, Double> composition, String grade, String requestId) {
        return analyze(Composition.of(composition), grade, requestId);
    }

    public AnalysisResult analyze(Composition composition, String grade, String requestId) {
        flowLogger.logTransition(PipelineState.START, "grade=" + grade, requestId);
        List<String> validationIssues = new ArrayList<>();

        // ── Stage 1: anomaly evaluation (always) ──
        AnomalyOutcome anomalyOutcome = DecisionPolicy.shouldCheckAnomaly(composition)
            ? runAnomalyStage(composition, grade, requestId)
            : new AnomalyOutcome.Error(DecisionPolicy.ANOMALY_AGENT, "Anomaly check disabled by policy");
        AnomalyResult anomaly = anomalyOutcome.result();
        flowLogger.logTransition(PipelineState.ANOMALY_DONE,
            "severity=" + anomaly.severity() + " score=" + format(anomaly.anomalyScore()), requestId);
        if (anomalyOutcome instanceof AnomalyOutcome.Success) {
            validate(DecisionPolicy.ANOMALY_AGENT, anomaly, validationIssues, requestId);
        }

        // ── Stage 2: conditional alloy correction, gated on anomaly severity ──
        CorrectionOutcome correctionOutcome;
        if (DecisionPolicy.shouldRecommendAlloy(anomaly)) {
            correctionOutcome = runCorrectionStage(grade, composition, requestId);
            flowLogger.logTransition(PipelineState.CORRECTION_DONE,
                "status=" + correctionOutcome.status(), requestId);
            if (correctionOutcome instanceof CorrectionOutcome.Success) {
                validate(DecisionPolicy.ALLOY_AGENT, correctionOutcome.result(), validationIssues, requestId);
            }
        } else {
            correctionOutcome = new CorrectionOutcome.Skipped(DecisionPolicy.ALLOY_AGENT, NOT_INVOKED_REASON);
            record(requestId, ALLOY_RECOMMENDATION_SKIPPED, "Severity: " + anomaly.severity());
            flowLogger.logTransition(PipelineState.CORRECTION_SKIPPED,
                "severity=" + anomaly.severity(), requestId);
        }

        // ── Aggregation ──
        CorrectionResult correction = correctionOutcome.result();
        AnalysisResult result = new AnalysisResult(
            requestId,
            grade,
            anomaly,
            correction,
            correctionOutcome.status(),
            DecisionPolicy.requiresHumanApproval(anomaly, correction),
            DecisionPolicy.getSafetyNote(),
            validationIssues,
            Instant.now());
        flowLogger.logTransition(PipelineState.AGGREGATED,
            "correctionStatus=" + result.correctionStatus() + " validationIssues=" + validationIssues.size(),
            requestId);
        return result;
    }

    private AnomalyOutcome runAnomalyStage(Composition composition, String grade, String requestId) {
        try {
            AnomalyResult result = anomalyEvaluator.evaluate(composition, grade);
            record(requestId, ANOMALY_CHECK, String.format("Severity: %s, Score: %s",
                result.severity(), format(result.anomalyScore())));
            return new AnomalyOutcome.Success(result);
        } catch (ModelNotReadyException e) {
            log.warn("[AnalysisOrchestrator] Anomaly stage not ready. reason={} requestId={}",
                e.getMessage(), requestId);
            record(requestId, ANOMALY_CHECK, "ERROR: " + e.getMessage());
            return new AnomalyOutcome.Error(DecisionPolicy.ANOMALY_AGENT, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[AnalysisOrchestrator] Anomaly stage failed. requestId={}", requestId, e);
            record(requestId, ANOMALY_CHECK, "ERROR: " + e.getMessage());
            return new AnomalyOutcome.Error(DecisionPolicy.ANOMALY_AGENT, e.getMessage());
        }
    }

    private CorrectionOutcome runCorrectionStage(String grade, Composition composition, String requestId) {
        try {
            CorrectionResult result = correctionRecommender.recommend(grade, composition);
            record(requestId, ALLOY_RECOMMENDATION, String.format("Grade: %s, Additions: %d elements",
                grade, result.additions().size()));
            return new CorrectionOutcome.Success(result);
        } catch (ModelNotReadyException e) {
            log.warn("[AnalysisOrchestrator] Correction stage not ready. reason={} requestId={}",
                e.getMessage(), requestId);
            record(requestId, ALLOY_RECOMMENDATION, "ERROR: " + e.getMessage());
            return new CorrectionOutcome.Error(DecisionPolicy.ALLOY_AGENT, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[AnalysisOrchestrator] Correction stage failed. grade={} requestId={}", grade, requestId, e);
            record(requestId, ALLOY_RECOMMENDATION, "ERROR: " + e.getMessage());
            return new CorrectionOutcome.Error(DecisionPolicy.ALLOY_AGENT, e.getMessage());
        }
    }

    private void validate(String agentName, StageResponse response, List<String> issues, String requestId) {
        String failure = DecisionPolicy.validationFailure(agentName, response);
        if (failure != null) {
            log.warn("[AnalysisOrchestrator] Invalid {} response passed through. reason={} requestId={}",
                agentName, failure, requestId);
            issues.add(agentName + ": " + failure);
        }
    }

    private void record(String requestId, String decision, String reason) {
        auditSink.append(DecisionRecord.of(requestId, decision, reason));
    }

    public AnomalyEvaluator anomalyEvaluator() {
        return anomalyEvaluator;
    }

    public CorrectionRecommender correctionRecommender() {
        return correctionRecommender;
    }

    public PipelineContext context() {
        return context;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
