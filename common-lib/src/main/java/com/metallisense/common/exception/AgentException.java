package com.metallisense.common.exception;

/**
 * Failure raised by a pipeline stage. The message is prefixed with the stage
 * (agent) name so audit and log lines identify where it happened.
 */
public class AgentException extends RuntimeException {
    private final String agentName;

    public AgentException(String agentName, String message) {
        super("[" + agentName + "] " + message);
        this.agentName = agentName;
    }

    public AgentException(String agentName, String message, Throwable cause) {
        super("[" + agentName + "] " + message, cause);
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }
}
