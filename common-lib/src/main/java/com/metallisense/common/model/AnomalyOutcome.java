package com.metallisense.common.model;

/**
 * Tagged result of the anomaly stage: either a scored reading or the reason
 * scoring failed.
 */
public sealed interface AnomalyOutcome permits AnomalyOutcome.Success, AnomalyOutcome.Error {

    /** The stage output to surface; failures become an ERROR-tagged result. */
    AnomalyResult result();

    record Success(AnomalyResult result) implements AnomalyOutcome {}

    record Error(String agent, String reason) implements AnomalyOutcome {
        @Override
        public AnomalyResult result() {
            return AnomalyResult.error(agent, reason);
        }
    }
}
