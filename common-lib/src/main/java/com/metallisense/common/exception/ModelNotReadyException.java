package com.metallisense.common.exception;

/**
 * The trained capability behind a stage is not loaded.
 */
public class ModelNotReadyException extends AgentException {

    public ModelNotReadyException(String agentName, String message) {
        super(agentName, message);
    }
}
