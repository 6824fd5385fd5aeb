package com.metallisense.orchestrator.service;

import com.metallisense.common.anomaly.AnomalyEvaluator;
import com.metallisense.common.audit.DecisionRecordSink;
import com.metallisense.common.correction.CorrectionRecommender;
import com.metallisense.common.grade.GradeDocument;
import com.metallisense.common.grade.GradeRegistry;
import com.metallisense.common.model.AnalysisResult;
import com.metallisense.common.model.AnomalyResult;
import com.metallisense.common.model.Composition;
import com.metallisense.common.model.CorrectionResult;
import com.metallisense.common.model.DecisionRecord;
import com.metallisense.common.policy.DecisionPolicy;
import com.metallisense.common.trace.TraceContextUtil;
import com.metallisense.orchestrator.dto.AgentStatusResponse;
import com.metallisense.orchestrator.dto.AgentStatusResponse.AgentStatus;
import com.metallisense.orchestrator.dto.GradeListResponse;
import com.metallisense.orchestrator.dto.HealthResponse;
import com.metallisense.orchestrator.logger.DecisionFlowLogger;
import com.metallisense.orchestrator.pipeline.AnalysisOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reactive boundary over the synchronous pipeline.
 *
 * <p>Each call runs on {@code boundedElastic} so model inference never blocks the
 * event loop. The request id travels in the Reactor Context and is bridged to MDC
 * only while logging.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    public static final String MANAGER_VERSION = "1.0.0";

    private final AnalysisOrchestrator orchestrator;
    private final DecisionRecordSink auditSink;
    private final DecisionFlowLogger decisionFlowLogger;

    public AnalysisService(AnalysisOrchestrator orchestrator, DecisionRecordSink auditSink,
                           DecisionFlowLogger decisionFlowLogger) {
        this.orchestrator       = orchestrator;
        this.auditSink          = auditSink;
        this.decisionFlowLogger = decisionFlowLogger;
    }

    /** Full pipeline. {@code requestIdHeader} may be null; an id is generated then. */
    public Mono<AnalysisResult> analyze(Map<String, Double> composition, String grade, String requestIdHeader) {
        String requestId = TraceContextUtil.resolveRequestId(requestIdHeader);
        decisionFlowLogger.logWithRequestId(DecisionFlowLogger.REQUEST_RECEIVED, requestId);

        Mono<AnalysisResult> pipeline = Mono.fromCallable(() -> orchestrator.analyze(composition, grade, requestId))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.RESPONSE_DISPATCHED))
            .doOnError(e -> TraceContextUtil.withMdc(requestId, () ->
                log.warn("[AnalysisService] Analysis rejected. reason={} requestId={}", e.getMessage(), requestId)));
        return TraceContextUtil.withRequestId(pipeline, requestId);
    }

    /**
     * Anomaly stage alone. Errors propagate so the boundary can map them to a status code.
     * A given grade must be registered; a null grade scores against the nearest one.
     */
    public Mono<AnomalyResult> predictAnomaly(Map<String, Double> composition, String grade) {
        return Mono.fromCallable(() -> {
                Composition parsed = Composition.of(composition);
                if (grade != null) {
                    orchestrator.context().gradeRegistry().getSpec(grade);
                }
                AnomalyEvaluator evaluator = orchestrator.anomalyEvaluator();
                return evaluator.evaluate(parsed, grade);
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Correction stage alone. Unlike the pipeline, an unknown grade is rejected here
     * instead of producing an empty recommendation.
     */
    public Mono<CorrectionResult> recommendAlloy(Map<String, Double> composition, String grade) {
        return Mono.fromCallable(() -> {
                Composition parsed = Composition.of(composition);
                orchestrator.context().gradeRegistry().getSpec(grade);
                CorrectionRecommender recommender = orchestrator.correctionRecommender();
                return recommender.recommend(grade, parsed);
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    public GradeListResponse grades() {
        List<String> grades = orchestrator.context().gradeRegistry().availableGrades();
        return new GradeListResponse(grades, grades.size());
    }

    /** @throws com.metallisense.common.exception.UnknownGradeException for an unregistered grade */
    public GradeDocument gradeSpec(String grade) {
        GradeRegistry registry = orchestrator.context().gradeRegistry();
        return GradeDocument.from(registry.getSpec(grade));
    }

    public HealthResponse health() {
        Map<String, Boolean> modelsLoaded = new LinkedHashMap<>();
        modelsLoaded.put("anomaly_model", orchestrator.anomalyEvaluator().isReady());
        modelsLoaded.put("alloy_model", orchestrator.correctionRecommender().isReady());
        modelsLoaded.put("agent_manager", orchestrator.context().isReady());
        boolean healthy = modelsLoaded.values().stream().allMatch(Boolean::booleanValue);
        return new HealthResponse(
            healthy ? "healthy" : "degraded",
            healthy ? "All models loaded" : "Some models not loaded",
            modelsLoaded);
    }

    public AgentStatusResponse status() {
        Map<String, AgentStatus> agents = new LinkedHashMap<>();
        agents.put("anomaly", new AgentStatus(
            orchestrator.anomalyEvaluator().isReady(),
            orchestrator.anomalyEvaluator().scoringModel().metadata()));
        agents.put("alloy", new AgentStatus(
            orchestrator.correctionRecommender().isReady(),
            orchestrator.correctionRecommender().regressionModel().metadata()));
        return new AgentStatusResponse(MANAGER_VERSION, DecisionPolicy.VERSION, agents,
            orchestrator.context().isReady());
    }

    public List<DecisionRecord> recentAudit(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return auditSink.recent(limit);
    }
}
