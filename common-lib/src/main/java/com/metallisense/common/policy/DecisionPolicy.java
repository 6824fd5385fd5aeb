package com.metallisense.common.policy;

import com.metallisense.common.model.AnomalyResult;
import com.metallisense.common.model.Composition;
import com.metallisense.common.model.CorrectionResult;
import com.metallisense.common.model.Severity;
import com.metallisense.common.model.StageResponse;

import java.util.List;

/**
 * Rules deciding which stages run, whether their output is trustworthy, and
 * what the pipeline may never do on its own.
 *
 * <p>Rules:
 * <ul>
 *   <li>Anomaly detection always runs, and always runs first.</li>
 *   <li>Alloy correction runs only for MEDIUM or HIGH severity.</li>
 *   <li>Every result requires human approval; no action is ever autonomous.</li>
 * </ul>
 *
 * <p>Pure static functions of their arguments. No state, no logging, no I/O.
 */
public final class DecisionPolicy {

    public static final String VERSION = "1.0.0";

    public static final String ANOMALY_AGENT = "AnomalyDetectionAgent";
    public static final String ALLOY_AGENT   = "AlloyCorrectionAgent";

    public static final String SAFETY_NOTE = "Human approval required before action";

    private DecisionPolicy() {}

    public static boolean shouldCheckAnomaly(Composition composition) {
        return true;
    }

    /** True iff the anomaly stage resolved to MEDIUM or HIGH severity. */
    public static boolean shouldRecommendAlloy(AnomalyResult anomalyResult) {
        if (anomalyResult == null) {
            return false;
        }
        Severity severity = anomalyResult.severity();
        return severity == Severity.MEDIUM || severity == Severity.HIGH;
    }

    /** Anomaly detection first; alloy correction is conditional on its severity. */
    public static List<String> executionOrder() {
        return List.of(ANOMALY_AGENT, ALLOY_AGENT);
    }

    public static boolean requiresHumanApproval(AnomalyResult anomalyResult, CorrectionResult correctionResult) {
        return true;
    }

    /** No autonomous actuation path exists, whatever the action. */
    public static boolean isActionAllowed(String action) {
        return false;
    }

    public static String getSafetyNote() {
        return SAFETY_NOTE;
    }

    /**
     * Checks a stage output before it is surfaced: it must carry the expected
     * agent name, a confidence in [0, 1], and an explanation.
     */
    public static boolean validateAgentResponse(String agentName, StageResponse response) {
        return validationFailure(agentName, response) == null;
    }

    /**
     * Returns why {@code response} fails validation, or {@code null} when it is valid.
     */
    public static String validationFailure(String agentName, StageResponse response) {
        if (response == null) {
            return "response is missing";
        }
        if (response.agent() == null || !response.agent().equals(agentName)) {
            return "agent name " + response.agent() + " does not match " + agentName;
        }
        double confidence = response.confidence();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            return "confidence " + confidence + " outside [0, 1]";
        }
        if (response.explanation() == null || response.explanation().isBlank()) {
            return "explanation is missing";
        }
        return null;
    }
}
