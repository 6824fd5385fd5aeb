package com.metallisense.orchestrator.capability;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Persisted regression model: the grade encoding learned at training time and the
 * element order of its output vector.
 */
public record RegressionModelArtifact(
    @JsonProperty("model_type") String modelType,
    @JsonProperty("version") String version,
    @JsonProperty("grade_ids") Map<String, Integer> gradeIds,
    @JsonProperty("elements") List<String> elements
) {}
