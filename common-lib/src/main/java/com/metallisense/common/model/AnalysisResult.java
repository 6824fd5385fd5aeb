package com.metallisense.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated, advisory outcome of one analysis request.
 *
 * <p>{@code correction} is never null: when the correction stage was not invoked it
 * holds an empty placeholder and {@code correctionStatus} is {@link CorrectionStatus#SKIPPED}.
 * {@code safetyNote} is the same constant string for every request. Stage outputs that
 * failed policy validation are still returned, and listed in {@code validationIssues}.
 */
public record AnalysisResult(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("grade") String grade,
    @JsonProperty("anomaly") AnomalyResult anomaly,
    @JsonProperty("correction") CorrectionResult correction,
    @JsonProperty("correction_status") CorrectionStatus correctionStatus,
    @JsonProperty("requires_human_approval") boolean requiresHumanApproval,
    @JsonProperty("safety_note") String safetyNote,
    @JsonProperty("validation_issues") List<String> validationIssues,
    @JsonProperty("timestamp") Instant timestamp
) {
    public AnalysisResult {
        validationIssues = List.copyOf(validationIssues);
    }
}
