package com.metallisense.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** {@code grade} is optional; without it the reading is scored against the nearest grade. */
public record AnomalyRequest(
    @JsonProperty("composition") Map<String, Double> composition,
    @JsonProperty("grade") String grade
) {}
