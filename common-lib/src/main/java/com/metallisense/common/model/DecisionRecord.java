package com.metallisense.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Append-only audit entry written once per stage invocation.
 */
public record DecisionRecord(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("decision") String decision,
    @JsonProperty("reason") String reason,
    @JsonProperty("timestamp") Instant timestamp
) {
    public static DecisionRecord of(String requestId, String decision, String reason) {
        return new DecisionRecord(requestId, decision, reason, Instant.now());
    }
}
