package com.metallisense.common.correction;

import com.metallisense.common.model.Composition;

import java.util.Map;

/**
 * Trained multi-output regression capability recommending alloy additions.
 *
 * <p>The output holds one value per {@link com.metallisense.common.model.Element},
 * in element declaration order. Values are intended to be non-negative but the
 * underlying estimator may produce negative or very large predictions.
 */
public interface RegressionModel {

    double[] predict(int gradeId, Composition composition);

    /** Grade name to the stable identifier the model was trained with. */
    Map<String, Integer> gradeIds();

    boolean isReady();

    Map<String, Object> metadata();
}
