package com.metallisense.common.correction;

import com.metallisense.common.exception.ModelInferenceException;
import com.metallisense.common.exception.ModelNotReadyException;
import com.metallisense.common.grade.GradeRegistry;
import com.metallisense.common.model.Composition;
import com.metallisense.common.model.CorrectionResult;
import com.metallisense.common.model.Element;
import com.metallisense.common.model.PipelineSettings;
import com.metallisense.common.policy.DecisionPolicy;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts a raw {@link RegressionModel} prediction into safe, filtered alloy
 * additions with a confidence score and advisory text.
 *
 * <h3>Safety constraints</h3>
 * <ul>
 *   <li>negative predictions are floored at 0 (additions only, never removals)</li>
 *   <li>each addition is capped at {@code maxAdditionPercentage}</li>
 *   <li>additions below {@code significanceFloor} are dropped</li>
 * </ul>
 *
 * <h3>Confidence</h3>
 * <pre>
 *   0.4 · (1 − min(totalAddition / 5, 1))
 * + 0.3 · (1 − correctionsNeeded / trackedElements)
 * + 0.3 · (1 − min(totalAbsDeviation / 10, 1))
 * </pre>
 * clipped to [0, 1].
 *
 * <p>This class is stateless and thread-safe.
 */
public class CorrectionRecommender {

    private static final double ADDITION_SCALE  = 5.0;
    private static final double DEVIATION_SCALE = 10.0;

    private static final double ADDITION_WEIGHT   = 0.4;
    private static final double CORRECTION_WEIGHT = 0.3;
    private static final double DEVIATION_WEIGHT  = 0.3;

    private static final double HIGH_CONFIDENCE     = 0.8;
    private static final double MODERATE_CONFIDENCE = 0.6;

    static final String NO_ACTION_MESSAGE =
        "Composition is close to target. No significant additions needed.";
    static final String HIGH_CONFIDENCE_MESSAGE =
        "High confidence recommendation. Additions should bring composition into spec.";
    static final String MODERATE_CONFIDENCE_MESSAGE =
        "Moderate confidence. Consider verifying with metallurgical expert.";
    static final String LOW_CONFIDENCE_MESSAGE =
        "Low confidence. Large corrections needed. Manual review recommended.";

    private final RegressionModel regressionModel;
    private final GradeRegistry gradeRegistry;
    private final PipelineSettings settings;

    public CorrectionRecommender(RegressionModel regressionModel, GradeRegistry gradeRegistry,
                                 PipelineSettings settings) {
        this.regressionModel = regressionModel;
        this.gradeRegistry   = gradeRegistry;
        this.settings        = settings;
    }

    /**
     * Recommends additions moving {@code composition} toward the midpoint of {@code grade}.
     * An unknown grade yields an empty result rather than an exception.
     *
     * @throws ModelNotReadyException  if the regression model is not loaded
     * @throws ModelInferenceException if the regression model fails or returns a malformed vector
     */
    public CorrectionResult recommend(String grade, Composition composition) {
        if (!regressionModel.isReady()) {
            throw new ModelNotReadyException(DecisionPolicy.ALLOY_AGENT, "Regression model not ready");
        }

        Integer gradeId = grade == null ? null : regressionModel.gradeIds().get(grade);
        if (gradeId == null || !gradeRegistry.contains(grade)) {
            return CorrectionResult.empty(DecisionPolicy.ALLOY_AGENT,
                "Unknown grade: " + grade, "Grade not in training data: " + grade);
        }

        double[] raw;
        try {
            raw = regressionModel.predict(gradeId, composition);
        } catch (RuntimeException e) {
            throw new ModelInferenceException(DecisionPolicy.ALLOY_AGENT,
                "Regression model failed: " + e.getMessage(), e);
        }
        if (raw == null || raw.length != Element.values().length) {
            throw new ModelInferenceException(DecisionPolicy.ALLOY_AGENT, String.format(
                "Regression model returned %d values, expected %d",
                raw == null ? 0 : raw.length, Element.values().length));
        }

        Map<Element, Double> additions = constrain(raw,
            settings.maxAdditionPercentage(), settings.significanceFloor());
        double totalAbsDeviation = gradeRegistry.getDeviation(grade, composition).values().stream()
            .mapToDouble(Math::abs)
            .sum();
        double confidence = confidence(additions, totalAbsDeviation, settings.significanceFloor());

        Map<String, Double> bySymbol = new LinkedHashMap<>();
        additions.forEach((element, amount) -> bySymbol.put(element.symbol(), amount));

        return new CorrectionResult(
            DecisionPolicy.ALLOY_AGENT,
            bySymbol,
            confidence,
            message(additions, confidence),
            warning(additions, confidence),
            explain(grade, additions));
    }

    public boolean isReady() {
        return regressionModel.isReady();
    }

    public RegressionModel regressionModel() {
        return regressionModel;
    }

    // ── Constraint and scoring steps ───────────────────────────────

    /**
     * Floors at 0, caps at {@code cap}, drops values below {@code floor} and rounds
     * to 4 decimals. Non-finite predictions are treated as 0 when negative infinity
     * or NaN, and as the cap when positive infinity.
     */
    public static Map<Element, Double> constrain(double[] raw, double cap, double floor) {
        Map<Element, Double> additions = new LinkedHashMap<>();
        for (Element element : Element.values()) {
            double value = raw[element.ordinal()];
            if (Double.isNaN(value)) value = 0.0;
            value = Math.min(Math.max(0.0, value), cap);
            if (value > 0.0 && value >= floor) {
                additions.put(element, round4(value));
            }
        }
        return additions;
    }

    public static double confidence(Map<Element, Double> additions, double totalAbsDeviation,
                                    double significanceFloor) {
        double totalAddition = additions.values().stream().mapToDouble(Double::doubleValue).sum();
        long correctionsNeeded = additions.values().stream().filter(v -> v > significanceFloor).count();

        double additionFactor   = 1.0 - Math.min(totalAddition / ADDITION_SCALE, 1.0);
        double correctionFactor = 1.0 - ((double) correctionsNeeded / Element.values().length);
        double deviationFactor  = 1.0 - Math.min(totalAbsDeviation / DEVIATION_SCALE, 1.0);

        double confidence = ADDITION_WEIGHT * additionFactor
            + CORRECTION_WEIGHT * correctionFactor
            + DEVIATION_WEIGHT * deviationFactor;
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    static String message(Map<Element, Double> additions, double confidence) {
        if (additions.isEmpty())                return NO_ACTION_MESSAGE;
        if (confidence >= HIGH_CONFIDENCE)      return HIGH_CONFIDENCE_MESSAGE;
        if (confidence >= MODERATE_CONFIDENCE)  return MODERATE_CONFIDENCE_MESSAGE;
        return LOW_CONFIDENCE_MESSAGE;
    }

    String warning(Map<Element, Double> additions, double confidence) {
        double total = additions.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total > settings.largeAdditionThreshold()) {
            return String.format("Large total addition required (>%s%%). Consider re-melting or blending.",
                formatPercent(settings.largeAdditionThreshold()));
        }
        if (confidence < settings.minConfidenceThreshold()) {
            return String.format("Confidence below threshold (%s). Use with caution.",
                settings.minConfidenceThreshold());
        }
        return null;
    }

    static String explain(String grade, Map<Element, Double> additions) {
        if (additions.isEmpty()) {
            return "Composition is within acceptable range for " + grade + ". No additions required.";
        }
        String elements = additions.entrySet().stream()
            .map(e -> String.format(Locale.ROOT, "%s: +%.2f%%", e.getKey().symbol(), e.getValue()))
            .collect(Collectors.joining(", "));
        return "Adjusting elements toward " + grade + " grade midpoint. Recommended: " + elements + ".";
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    private static String formatPercent(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
