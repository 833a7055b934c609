package com.aether.core.entity;

/**
 * Thrown when enrolling an agent id that already has an actor or a stored history.
 */
public class AgentAlreadyEnrolledException extends RuntimeException {
    public AgentAlreadyEnrolledException(String agentId) {
        super("Agent already enrolled: " + agentId);
    }
}
