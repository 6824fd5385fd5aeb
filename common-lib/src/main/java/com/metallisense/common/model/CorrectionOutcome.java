package com.metallisense.common.model;

/**
 * Tagged result of the correction stage. {@link Skipped} is produced when the
 * policy gate does not invoke the stage at all.
 */
public sealed interface CorrectionOutcome
        permits CorrectionOutcome.Success, CorrectionOutcome.Skipped, CorrectionOutcome.Error {

    CorrectionResult result();

    CorrectionStatus status();

    record Success(CorrectionResult result) implements CorrectionOutcome {
        @Override
        public CorrectionStatus status() {
            return CorrectionStatus.INVOKED;
        }
    }

    record Skipped(String agent, String reason) implements CorrectionOutcome {
        @Override
        public CorrectionResult result() {
            return CorrectionResult.empty(agent, reason, null);
        }

        @Override
        public CorrectionStatus status() {
            return CorrectionStatus.SKIPPED;
        }
    }

    record Error(String agent, String reason) implements CorrectionOutcome {
        @Override
        public CorrectionResult result() {
            return CorrectionResult.empty(agent, "Agent execution error: " + reason, null);
        }

        @Override
        public CorrectionStatus status() {
            return CorrectionStatus.ERROR;
        }
    }
}
