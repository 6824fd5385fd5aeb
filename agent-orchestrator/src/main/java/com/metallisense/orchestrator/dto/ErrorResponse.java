package com.metallisense.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("status_code") int statusCode
) {}
