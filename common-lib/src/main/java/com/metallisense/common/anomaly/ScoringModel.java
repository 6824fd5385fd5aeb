package com.metallisense.common.anomaly;

import com.metallisense.common.model.Composition;

import java.util.Map;

/**
 * Trained anomaly scoring capability.
 *
 * <p>Lower raw scores mean more anomalous readings. Implementations are loaded
 * once and must be safe to call concurrently without mutation.
 */
public interface ScoringModel {

    /** Raw anomaly score for one reading. */
    double score(Composition composition);

    /**
     * Raw anomaly score for a reading that is meant to be {@code grade}. Models that
     * know nothing about grades score the reading as {@link #score(Composition)} does.
     */
    default double score(Composition composition, String grade) {
        return score(composition);
    }

    /** Calibration recorded alongside the model at training time. */
    ScoreCalibration calibration();

    boolean isReady();

    /** Descriptive metadata (model type, version, artifact source). */
    Map<String, Object> metadata();
}
