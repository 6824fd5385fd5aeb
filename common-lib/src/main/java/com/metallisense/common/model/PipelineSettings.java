package com.metallisense.common.model;

/**
 * Tunable constants of the decision pipeline.
 *
 * <ul>
 *   <li>{@code mediumThreshold} / {@code highThreshold}: normalized anomaly score
 *       boundaries for MEDIUM and HIGH severity</li>
 *   <li>{@code maxAdditionPercentage}: cap applied to every recommended addition</li>
 *   <li>{@code significanceFloor}: additions below this are dropped</li>
 *   <li>{@code minConfidenceThreshold}: recommendations below this carry a warning</li>
 *   <li>{@code largeAdditionThreshold}: total addition above this carries a re-melt warning</li>
 * </ul>
 */
public record PipelineSettings(
    double mediumThreshold,
    double highThreshold,
    double maxAdditionPercentage,
    double significanceFloor,
    double minConfidenceThreshold,
    double largeAdditionThreshold
) {

    public static final double DEFAULT_MEDIUM_THRESHOLD = 0.33;
    public static final double DEFAULT_HIGH_THRESHOLD = 0.66;
    public static final double DEFAULT_MAX_ADDITION_PERCENTAGE = 5.0;
    public static final double DEFAULT_SIGNIFICANCE_FLOOR = 0.01;
    public static final double DEFAULT_MIN_CONFIDENCE_THRESHOLD = 0.5;
    public static final double DEFAULT_LARGE_ADDITION_THRESHOLD = 3.0;

    public PipelineSettings {
        if (mediumThreshold <= 0.0 || highThreshold >= 1.0 || mediumThreshold >= highThreshold) {
            throw new IllegalArgumentException(String.format(
                "Severity thresholds must satisfy 0 < medium < high < 1, got medium=%s high=%s",
                mediumThreshold, highThreshold));
        }
        if (maxAdditionPercentage <= 0.0) {
            throw new IllegalArgumentException("maxAdditionPercentage must be positive");
        }
        if (significanceFloor < 0.0 || significanceFloor >= maxAdditionPercentage) {
            throw new IllegalArgumentException("significanceFloor must be in [0, maxAdditionPercentage)");
        }
        if (minConfidenceThreshold < 0.0 || minConfidenceThreshold > 1.0) {
            throw new IllegalArgumentException("minConfidenceThreshold must be in [0, 1]");
        }
        if (largeAdditionThreshold <= 0.0) {
            throw new IllegalArgumentException("largeAdditionThreshold must be positive");
        }
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(
            DEFAULT_MEDIUM_THRESHOLD, DEFAULT_HIGH_THRESHOLD,
            DEFAULT_MAX_ADDITION_PERCENTAGE, DEFAULT_SIGNIFICANCE_FLOOR,
            DEFAULT_MIN_CONFIDENCE_THRESHOLD, DEFAULT_LARGE_ADDITION_THRESHOLD);
    }
}
