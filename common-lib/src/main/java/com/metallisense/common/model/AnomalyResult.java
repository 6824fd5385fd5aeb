package com.metallisense.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of the anomaly stage. Created once per request and never mutated.
 */
public record AnomalyResult(
    @JsonProperty("agent") String agent,
    @JsonProperty("anomaly_score") double anomalyScore,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("explanation") String explanation
) implements StageResponse {

    public static AnomalyResult error(String agent, String reason) {
        return new AnomalyResult(agent, 0.0, Severity.ERROR, 0.0, "Agent execution error: " + reason);
    }
}
