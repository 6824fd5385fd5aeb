package com.metallisense.common.policy;

import com.metallisense.common.model.AnomalyResult;
import com.metallisense.common.model.CorrectionResult;
import com.metallisense.common.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionPolicyTest {

    private static AnomalyResult anomaly(Severity severity) {
        return new AnomalyResult(DecisionPolicy.ANOMALY_AGENT, 0.5, severity, 0.5, "explanation");
    }

    @Nested
    @DisplayName("stage gating")
    class Gating {

        @ParameterizedTest(name = "{0}")
        @EnumSource(Severity.class)
        @DisplayName("alloy correction runs only for MEDIUM and HIGH")
        void shouldRecommendAlloy(Severity severity) {
            boolean expected = severity == Severity.MEDIUM || severity == Severity.HIGH;
            assertEquals(expected, DecisionPolicy.shouldRecommendAlloy(anomaly(severity)));
        }

        @Test
        @DisplayName("missing anomaly result → no correction")
        void nullAnomaly() {
            assertFalse(DecisionPolicy.shouldRecommendAlloy(null));
        }

        @Test
        @DisplayName("anomaly check always runs, and runs first")
        void anomalyAlwaysFirst() {
            assertTrue(DecisionPolicy.shouldCheckAnomaly(null));
            assertEquals(List.of(DecisionPolicy.ANOMALY_AGENT, DecisionPolicy.ALLOY_AGENT),
                DecisionPolicy.executionOrder());
        }
    }

    @Nested
    @DisplayName("safety rules")
    class Safety {

        @Test
        @DisplayName("human approval is always required and no action is allowed")
        void neverAutonomous() {
            assertTrue(DecisionPolicy.requiresHumanApproval(anomaly(Severity.LOW), null));
            assertTrue(DecisionPolicy.requiresHumanApproval(null, null));
            assertFalse(DecisionPolicy.isActionAllowed("ADD_ALLOY"));
            assertFalse(DecisionPolicy.isActionAllowed(null));
            assertEquals("Human approval required before action", DecisionPolicy.getSafetyNote());
        }
    }

    @Nested
    @DisplayName("validateAgentResponse()")
    class Validation {

        @Test
        @DisplayName("well-formed response → valid")
        void valid() {
            assertTrue(DecisionPolicy.validateAgentResponse(DecisionPolicy.ANOMALY_AGENT, anomaly(Severity.LOW)));
            assertNull(DecisionPolicy.validationFailure(DecisionPolicy.ANOMALY_AGENT, anomaly(Severity.LOW)));
        }

        @Test
        @DisplayName("wrong agent name → invalid")
        void wrongAgent() {
            assertFalse(DecisionPolicy.validateAgentResponse(DecisionPolicy.ALLOY_AGENT, anomaly(Severity.LOW)));
        }

        @Test
        @DisplayName("confidence outside [0, 1] or NaN → invalid")
        void badConfidence() {
            for (double confidence : new double[] {-0.01, 1.01, Double.NaN}) {
                CorrectionResult result = new CorrectionResult(DecisionPolicy.ALLOY_AGENT, Map.of(),
                    confidence, "message", null, "explanation");
                assertFalse(DecisionPolicy.validateAgentResponse(DecisionPolicy.ALLOY_AGENT, result),
                    "confidence " + confidence);
            }
        }

        @Test
        @DisplayName("blank explanation or missing response → invalid")
        void missingParts() {
            AnomalyResult blank = new AnomalyResult(DecisionPolicy.ANOMALY_AGENT, 0.1, Severity.LOW, 0.8, " ");
            assertNotNull(DecisionPolicy.validationFailure(DecisionPolicy.ANOMALY_AGENT, blank));
            assertEquals("response is missing", DecisionPolicy.validationFailure(DecisionPolicy.ANOMALY_AGENT, null));
        }
    }
}
