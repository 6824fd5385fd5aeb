package com.metallisense.orchestrator.capability;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metallisense.common.anomaly.ScoreCalibration;

import java.util.List;

/**
 * Persisted scoring model: the reference grades it was fitted on and the raw-score
 * calibration recorded at fit time.
 */
public record ScoringModelArtifact(
    @JsonProperty("model_type") String modelType,
    @JsonProperty("version") String version,
    @JsonProperty("reference_grades") List<String> referenceGrades,
    @JsonProperty("calibration") ScoreCalibration calibration
) {}
