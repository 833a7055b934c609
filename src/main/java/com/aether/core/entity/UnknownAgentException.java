package com.aether.core.entity;

/**
 * Thrown when a signal or query names an agent that is not enrolled.
 */
public class UnknownAgentException extends RuntimeException {

    private final String agentId;

    public UnknownAgentException(String agentId) {
        super("Unknown agent: " + agentId);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
