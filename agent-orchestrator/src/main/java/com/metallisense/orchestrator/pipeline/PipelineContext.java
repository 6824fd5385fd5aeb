package com.metallisense.orchestrator.pipeline;

import com.metallisense.common.anomaly.ScoringModel;
import com.metallisense.common.correction.RegressionModel;
import com.metallisense.common.grade.GradeRegistry;
import com.metallisense.common.model.PipelineSettings;

/**
 * Load-once, read-only collaborators shared by every request: the grade table,
 * both trained capabilities and the pipeline settings.
 *
 * <p>Built explicitly at startup and injected into {@link AnalysisOrchestrator};
 * nothing in it is mutated afterwards.
 */
public record PipelineContext(
    GradeRegistry gradeRegistry,
    ScoringModel scoringModel,
    RegressionModel regressionModel,
    PipelineSettings settings
) {
    public boolean isReady() {
        return scoringModel.isReady() && regressionModel.isReady();
    }
}
