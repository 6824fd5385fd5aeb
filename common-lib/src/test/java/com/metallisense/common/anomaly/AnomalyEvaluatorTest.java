package com.metallisense.common.anomaly;

import com.metallisense.common.exception.ModelInferenceException;
import com.metallisense.common.exception.ModelNotReadyException;
import com.metallisense.common.model.AnomalyResult;
import com.metallisense.common.model.Composition;
import com.metallisense.common.model.Element;
import com.metallisense.common.model.PipelineSettings;
import com.metallisense.common.model.Severity;
import com.metallisense.common.policy.DecisionPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.function.ToDoubleFunction;

import static org.junit.jupiter.api.Assertions.*;

class AnomalyEvaluatorTest {

    private static final ScoreCalibration CALIBRATION = new ScoreCalibration(-3.0, 0.0);

    /** Raw score falls linearly with the Fe distance from 86%. */
    private static final ToDoubleFunction<Composition> FE_DISTANCE =
        c -> -Math.abs(c.get(Element.FE) - 86.0) / 2.0;

    private record StubScoringModel(ToDoubleFunction<Composition> scorer, boolean isReady) implements ScoringModel {
        @Override public double score(Composition composition) { return scorer.applyAsDouble(composition); }
        @Override public ScoreCalibration calibration() { return CALIBRATION; }
        @Override public Map<String, Object> metadata() { return Map.of("model_type", "stub"); }
    }

    private static AnomalyEvaluator evaluator(ToDoubleFunction<Composition> scorer) {
        return new AnomalyEvaluator(new StubScoringModel(scorer, true), PipelineSettings.defaults());
    }

    private static Composition withFe(double fe) {
        return Composition.of(Map.of("Fe", fe, "C", 3.5, "Si", 2.3, "Mn", 0.65, "P", 0.045, "S", 0.02));
    }

    @Nested
    @DisplayName("normalize() / classify() / confidence()")
    class ScoringContract {

        @Test
        @DisplayName("score_max → 0, score_min → 1, midpoint → 0.5")
        void normalizeEndpoints() {
            assertEquals(0.0, AnomalyEvaluator.normalize(0.0, CALIBRATION), 1e-12);
            assertEquals(1.0, AnomalyEvaluator.normalize(-3.0, CALIBRATION), 1e-12);
            assertEquals(0.5, AnomalyEvaluator.normalize(-1.5, CALIBRATION), 1e-12);
        }

        @Test
        @DisplayName("raw scores outside the calibration range are clipped to [0, 1]")
        void normalizeClips() {
            assertEquals(1.0, AnomalyEvaluator.normalize(-30.0, CALIBRATION));
            assertEquals(0.0, AnomalyEvaluator.normalize(2.0, CALIBRATION));
        }

        @Test
        @DisplayName("thresholds: < 0.33 LOW, < 0.66 MEDIUM, otherwise HIGH")
        void classifyThresholds() {
            assertEquals(Severity.LOW,    AnomalyEvaluator.classify(0.0, 0.33, 0.66));
            assertEquals(Severity.LOW,    AnomalyEvaluator.classify(0.3299, 0.33, 0.66));
            assertEquals(Severity.MEDIUM, AnomalyEvaluator.classify(0.33, 0.33, 0.66));
            assertEquals(Severity.MEDIUM, AnomalyEvaluator.classify(0.6599, 0.33, 0.66));
            assertEquals(Severity.HIGH,   AnomalyEvaluator.classify(0.66, 0.33, 0.66));
            assertEquals(Severity.HIGH,   AnomalyEvaluator.classify(1.0, 0.33, 0.66));
        }

        @Test
        @DisplayName("confidence is 1 at the extremes and 0 at 0.5")
        void confidenceShape() {
            assertEquals(1.0, AnomalyEvaluator.confidence(0.0), 1e-12);
            assertEquals(1.0, AnomalyEvaluator.confidence(1.0), 1e-12);
            assertEquals(0.0, AnomalyEvaluator.confidence(0.5), 1e-12);
            assertEquals(0.4, AnomalyEvaluator.confidence(0.3), 1e-9);
        }

        @Test
        @DisplayName("each severity has its own explanation")
        void explanations() {
            assertEquals(AnomalyEvaluator.LOW_EXPLANATION, AnomalyEvaluator.explain(Severity.LOW));
            assertEquals(AnomalyEvaluator.MEDIUM_EXPLANATION, AnomalyEvaluator.explain(Severity.MEDIUM));
            assertEquals(AnomalyEvaluator.HIGH_EXPLANATION, AnomalyEvaluator.explain(Severity.HIGH));
        }
    }

    @Nested
    @DisplayName("evaluate()")
    class Evaluate {

        @Test
        @DisplayName("identical input twice → identical result")
        void idempotent() {
            AnomalyEvaluator evaluator = evaluator(FE_DISTANCE);
            AnomalyResult first  = evaluator.evaluate(withFe(84.0));
            AnomalyResult second = evaluator.evaluate(withFe(84.0));
            assertEquals(first, second);
            assertEquals(Double.doubleToLongBits(first.anomalyScore()),
                Double.doubleToLongBits(second.anomalyScore()));
        }

        @Test
        @DisplayName("moving further from the target never lowers score or severity")
        void monotonic() {
            AnomalyEvaluator evaluator = evaluator(FE_DISTANCE);
            AnomalyResult previous = evaluator.evaluate(withFe(86.0));
            for (double fe = 86.5; fe <= 95.0; fe += 0.5) {
                AnomalyResult current = evaluator.evaluate(withFe(fe));
                assertTrue(current.anomalyScore() >= previous.anomalyScore(), "score dropped at Fe=" + fe);
                assertTrue(current.severity().compareTo(previous.severity()) >= 0, "severity dropped at Fe=" + fe);
                previous = current;
            }
            assertEquals(Severity.HIGH, previous.severity());
        }

        @Test
        @DisplayName("result carries the anomaly agent name and a score in [0, 1]")
        void resultShape() {
            AnomalyResult result = evaluator(FE_DISTANCE).evaluate(withFe(88.0));
            assertEquals(DecisionPolicy.ANOMALY_AGENT, result.agent());
            assertEquals(1.0 / 3.0, result.anomalyScore(), 1e-9);
            assertEquals(Severity.MEDIUM, result.severity());
            assertTrue(DecisionPolicy.validateAgentResponse(DecisionPolicy.ANOMALY_AGENT, result));
        }

        @Test
        @DisplayName("model not ready → ModelNotReadyException")
        void notReady() {
            AnomalyEvaluator evaluator =
                new AnomalyEvaluator(new StubScoringModel(FE_DISTANCE, false), PipelineSettings.defaults());
            ModelNotReadyException e = assertThrows(ModelNotReadyException.class,
                () -> evaluator.evaluate(withFe(86.0)));
            assertEquals(DecisionPolicy.ANOMALY_AGENT, e.getAgentName());
            assertFalse(evaluator.isReady());
        }

        @Test
        @DisplayName("failing or non-finite model → ModelInferenceException")
        void inferenceFailure() {
            AnomalyEvaluator failing = evaluator(c -> { throw new IllegalStateException("boom"); });
            assertThrows(ModelInferenceException.class, () -> failing.evaluate(withFe(86.0)));

            AnomalyEvaluator nan = evaluator(c -> Double.NaN);
            assertThrows(ModelInferenceException.class, () -> nan.evaluate(withFe(86.0)));
        }
    }
}
