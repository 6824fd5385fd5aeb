package com.metallisense.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of the correction stage.
 *
 * <p>{@code additions} is keyed by element symbol in element order; every value is
 * non-negative and capped. An empty map means no action is recommended.
 */
public record CorrectionResult(
    @JsonProperty("agent") String agent,
    @JsonProperty("recommended_additions") Map<String, Double> additions,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("message") String message,
    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonProperty("warning") String warning,
    @JsonProperty("explanation") String explanation
) implements StageResponse {

    public CorrectionResult {
        additions = Collections.unmodifiableMap(new LinkedHashMap<>(additions));
    }

    /** Empty result with no recommendation; used for skipped, unknown-grade and failed stages. */
    public static CorrectionResult empty(String agent, String message, String warning) {
        return new CorrectionResult(agent, Map.of(), 0.0, message, warning, message);
    }

    public double totalAddition() {
        return additions.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
