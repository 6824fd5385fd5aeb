package com.metallisense.orchestrator.capability;

import com.metallisense.common.correction.RegressionModel;
import com.metallisense.common.exception.ModelNotReadyException;
import com.metallisense.common.model.Composition;
import com.metallisense.common.policy.DecisionPolicy;

import java.util.Map;

/**
 * Placeholder used when no regression artifact could be loaded. Reports not-ready.
 */
public record UnloadedRegressionModel(String reason) implements RegressionModel {

    @Override
    public double[] predict(int gradeId, Composition composition) {
        throw new ModelNotReadyException(DecisionPolicy.ALLOY_AGENT, reason);
    }

    @Override
    public Map<String, Integer> gradeIds() {
        return Map.of();
    }

    @Override
    public boolean isReady() {
        return false;
    }

    @Override
    public Map<String, Object> metadata() {
        return Map.of("loaded", false, "reason", reason);
    }
}
