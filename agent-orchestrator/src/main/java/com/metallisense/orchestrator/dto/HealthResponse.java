package com.metallisense.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * {@code status} is {@code healthy} only when every entry of {@code modelsLoaded} is true,
 * {@code degraded} otherwise.
 */
public record HealthResponse(
    @JsonProperty("status") String status,
    @JsonProperty("message") String message,
    @JsonProperty("models_loaded") Map<String, Boolean> modelsLoaded
) {}
