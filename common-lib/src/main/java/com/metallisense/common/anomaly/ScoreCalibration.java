package com.metallisense.common.anomaly;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fixed min/max of a scoring model's raw output distribution, recorded when the
 * model was fitted and persisted with it. Used to map raw scores into [0, 1].
 */
public record ScoreCalibration(
    @JsonProperty("score_min") double scoreMin,
    @JsonProperty("score_max") double scoreMax
) {
    public ScoreCalibration {
        if (!(scoreMax > scoreMin)) {
            throw new IllegalArgumentException(String.format(
                "Calibration requires score_max > score_min, got min=%s max=%s", scoreMin, scoreMax));
        }
    }
}
