package com.metallisense.common.exception;

/**
 * A capability failed while producing its raw output (score or additions vector).
 */
public class ModelInferenceException extends AgentException {

    public ModelInferenceException(String agentName, String message) {
        super(agentName, message);
    }

    public ModelInferenceException(String agentName, String message, Throwable cause) {
        super(agentName, message, cause);
    }
}
