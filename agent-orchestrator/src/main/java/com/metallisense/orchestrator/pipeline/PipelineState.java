package com.metallisense.orchestrator.pipeline;

/**
 * Per-request progress of {@link AnalysisOrchestrator}. Transitions are strictly
 * sequential: START → ANOMALY_DONE → (CORRECTION_DONE | CORRECTION_SKIPPED) → AGGREGATED.
 */
public enum PipelineState {
    START,
    ANOMALY_DONE,
    CORRECTION_DONE,
    CORRECTION_SKIPPED,
    AGGREGATED
}
