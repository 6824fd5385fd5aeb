package com.metallisense.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Body of the analyze and single-stage recommend endpoints. */
public record AnalysisRequest(
    @JsonProperty("composition") Map<String, Double> composition,
    @JsonProperty("grade") String grade
) {}
