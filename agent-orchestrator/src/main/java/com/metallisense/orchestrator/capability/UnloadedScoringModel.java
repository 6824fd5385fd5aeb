package com.metallisense.orchestrator.capability;

import com.metallisense.common.anomaly.ScoreCalibration;
import com.metallisense.common.anomaly.ScoringModel;
import com.metallisense.common.exception.ModelNotReadyException;
import com.metallisense.common.model.Composition;
import com.metallisense.common.policy.DecisionPolicy;

import java.util.Map;

/**
 * Placeholder used when no scoring artifact could be loaded. Reports not-ready.
 */
public record UnloadedScoringModel(String reason) implements ScoringModel {

    @Override
    public double score(Composition composition) {
        throw new ModelNotReadyException(DecisionPolicy.ANOMALY_AGENT, reason);
    }

    @Override
    public ScoreCalibration calibration() {
        throw new ModelNotReadyException(DecisionPolicy.ANOMALY_AGENT, reason);
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
