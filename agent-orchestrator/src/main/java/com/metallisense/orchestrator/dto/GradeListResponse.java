package com.metallisense.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record GradeListResponse(
    @JsonProperty("grades") List<String> grades,
    @JsonProperty("count") int count
) {}
