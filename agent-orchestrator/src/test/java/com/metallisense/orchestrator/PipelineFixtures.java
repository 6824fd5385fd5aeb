package com.metallisense.orchestrator;

import com.metallisense.common.anomaly.AnomalyEvaluator;
import com.metallisense.common.anomaly.ScoreCalibration;
import com.metallisense.common.audit.DecisionRecordSink;
import com.metallisense.common.correction.CorrectionRecommender;
import com.metallisense.common.grade.GradeRegistry;
import com.metallisense.common.model.DecisionRecord;
import com.metallisense.common.model.GradeSpec;
import com.metallisense.common.model.PipelineSettings;
import com.metallisense.orchestrator.capability.GradeCentroidScoringModel;
import com.metallisense.orchestrator.capability.MidpointGapRegressionModel;
import com.metallisense.orchestrator.logger.DecisionFlowLogger;
import com.metallisense.orchestrator.pipeline.AnalysisOrchestrator;
import com.metallisense.orchestrator.pipeline.PipelineContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shared builders for pipeline tests: the shipped reference capabilities over the built-in grades. */
public final class PipelineFixtures {

    public static final ScoreCalibration CALIBRATION = new ScoreCalibration(-3.0, 0.0);

    private PipelineFixtures() {}

    public static PipelineContext referenceContext() {
        GradeRegistry registry = GradeRegistry.defaults();
        return new PipelineContext(registry, scoringModel(registry), regressionModel(registry),
            PipelineSettings.defaults());
    }

    /** Orchestrator wired with the evaluator and recommender built from {@code context}. */
    public static AnalysisOrchestrator orchestrator(PipelineContext context, DecisionRecordSink sink) {
        return new AnalysisOrchestrator(context,
            new AnomalyEvaluator(context.scoringModel(), context.settings()),
            new CorrectionRecommender(context.regressionModel(), context.gradeRegistry(), context.settings()),
            sink, new DecisionFlowLogger());
    }

    public static GradeCentroidScoringModel scoringModel(GradeRegistry registry) {
        return new GradeCentroidScoringModel(List.copyOf(registry.allSpecs()), CALIBRATION, "test", "fixture");
    }

    public static MidpointGapRegressionModel regressionModel(GradeRegistry registry) {
        Map<String, Integer> gradeIds = new LinkedHashMap<>();
        Map<String, GradeSpec> specs = new LinkedHashMap<>();
        int id = 0;
        for (GradeSpec spec : registry.allSpecs()) {
            gradeIds.put(spec.grade(), id++);
            specs.put(spec.grade(), spec);
        }
        return new MidpointGapRegressionModel(gradeIds, specs, "test", "fixture");
    }

    /** Grey iron melt with Fe slightly above range. */
    public static Map<String, Double> greyIronMelt() {
        return melt(93.5, 3.2, 2.1, 0.65, 0.08, 0.12);
    }

    /** SG iron melt with Fe below range and C, Si above it. */
    public static Map<String, Double> sgIronMelt() {
        return melt(81.2, 4.4, 3.1, 0.4, 0.04, 0.02);
    }

    public static Map<String, Double> melt(double fe, double c, double si, double mn, double p, double s) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("Fe", fe);
        values.put("C", c);
        values.put("Si", si);
        values.put("Mn", mn);
        values.put("P", p);
        values.put("S", s);
        return values;
    }

    /** In-memory audit sink recording every append. */
    public static final class RecordingSink implements DecisionRecordSink {

        private final List<DecisionRecord> records = new ArrayList<>();

        @Override
        public synchronized void append(DecisionRecord record) {
            records.add(record);
        }

        @Override
        public synchronized List<DecisionRecord> recent(int limit) {
            return List.copyOf(records.subList(Math.max(0, records.size() - limit), records.size()));
        }

        public synchronized List<String> decisions() {
            return records.stream().map(DecisionRecord::decision).toList();
        }

        public synchronized List<DecisionRecord> records() {
            return List.copyOf(records);
        }
    }
}
