package com.metallisense.common.anomaly;

import com.metallisense.common.exception.ModelInferenceException;
import com.metallisense.common.exception.ModelNotReadyException;
import com.metallisense.common.model.AnomalyResult;
import com.metallisense.common.model.Composition;
import com.metallisense.common.model.PipelineSettings;
import com.metallisense.common.model.Severity;
import com.metallisense.common.policy.DecisionPolicy;

/**
 * Turns a raw {@link ScoringModel} output into a normalized anomaly score,
 * severity bucket, confidence and explanation.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>{@code raw = model.score(composition, grade)}, or {@code model.score(composition)}
 *       when no target grade is given</li>
 *   <li>{@code normalized = clip((scoreMax - raw) / (scoreMax - scoreMin), 0, 1)},
 *       so 0 is normal and 1 is highly anomalous</li>
 *   <li>severity: {@code < medium} → LOW, {@code [medium, high)} → MEDIUM, {@code ≥ high} → HIGH</li>
 *   <li>{@code confidence = clip(2·|normalized − 0.5|, 0, 1)}</li>
 * </ol>
 *
 * <p>Calibration is read from the model once per call and never resampled, so the
 * same composition always yields the same result. Stateless and thread-safe.
 */
public class AnomalyEvaluator {

    static final String LOW_EXPLANATION =
        "Detected deviation from historical composition distribution. "
        + "Reading is within normal operational variance.";
    static final String MEDIUM_EXPLANATION =
        "Moderate anomaly detected in composition pattern. "
        + "Recommend verifying sensor calibration and melt stability.";
    static final String HIGH_EXPLANATION =
        "High anomaly detected - composition significantly deviates from historical patterns. "
        + "Possible sensor drift, contamination, or unstable melt chemistry. Human inspection recommended.";

    private final ScoringModel scoringModel;
    private final double mediumThreshold;
    private final double highThreshold;

    public AnomalyEvaluator(ScoringModel scoringModel, PipelineSettings settings) {
        this.scoringModel    = scoringModel;
        this.mediumThreshold = settings.mediumThreshold();
        this.highThreshold   = settings.highThreshold();
    }

    /**
     * Scores {@code composition} without a target grade.
     *
     * @throws ModelNotReadyException   if the scoring model is not loaded
     * @throws ModelInferenceException  if the scoring model fails or returns a non-finite score
     */
    public AnomalyResult evaluate(Composition composition) {
        return evaluate(composition, null);
    }

    /**
     * Scores {@code composition} against the grade it is meant to be. A null grade
     * falls back to the model's grade-independent score.
     *
     * @throws ModelNotReadyException   if the scoring model is not loaded
     * @throws ModelInferenceException  if the scoring model fails or returns a non-finite score
     */
    public AnomalyResult evaluate(Composition composition, String grade) {
        if (!scoringModel.isReady()) {
            throw new ModelNotReadyException(DecisionPolicy.ANOMALY_AGENT, "Scoring model not ready");
        }

        double raw;
        try {
            raw = grade == null ? scoringModel.score(composition) : scoringModel.score(composition, grade);
        } catch (RuntimeException e) {
            throw new ModelInferenceException(DecisionPolicy.ANOMALY_AGENT,
                "Scoring model failed: " + e.getMessage(), e);
        }
        if (Double.isNaN(raw) || Double.isInfinite(raw)) {
            throw new ModelInferenceException(DecisionPolicy.ANOMALY_AGENT,
                "Scoring model returned non-finite score " + raw);
        }

        double normalized = normalize(raw, scoringModel.calibration());
        Severity severity = classify(normalized, mediumThreshold, highThreshold);
        return new AnomalyResult(
            DecisionPolicy.ANOMALY_AGENT,
            normalized,
            severity,
            confidence(normalized),
            explain(severity));
    }

    public boolean isReady() {
        return scoringModel.isReady();
    }

    public ScoringModel scoringModel() {
        return scoringModel;
    }

    // ── Scoring contract ───────────────────────────────────────────

    /** Inverts and rescales a raw score into [0, 1]; 0 = normal, 1 = highly anomalous. */
    public static double normalize(double raw, ScoreCalibration calibration) {
        double normalized = (calibration.scoreMax() - raw)
            / (calibration.scoreMax() - calibration.scoreMin());
        return clip(normalized);
    }

    public static Severity classify(double normalized, double mediumThreshold, double highThreshold) {
        if (normalized < mediumThreshold) return Severity.LOW;
        if (normalized < highThreshold)   return Severity.MEDIUM;
        return Severity.HIGH;
    }

    /** Maximal at the extremes, zero at the ambiguous midpoint. */
    public static double confidence(double normalized) {
        return clip(2.0 * Math.abs(normalized - 0.5));
    }

    public static String explain(Severity severity) {
        return switch (severity) {
            case LOW    -> LOW_EXPLANATION;
            case MEDIUM -> MEDIUM_EXPLANATION;
            case HIGH   -> HIGH_EXPLANATION;
            case ERROR  -> "Unable to classify anomaly severity.";
        };
    }

    private static double clip(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
