package com.metallisense.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record AgentStatusResponse(
    @JsonProperty("manager_version") String managerVersion,
    @JsonProperty("policy_version") String policyVersion,
    @JsonProperty("agents") Map<String, AgentStatus> agents,
    @JsonProperty("ready") boolean ready
) {

    public record AgentStatus(
        @JsonProperty("ready") boolean ready,
        @JsonProperty("metadata") Map<String, Object> metadata
    ) {}
}
