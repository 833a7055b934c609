package com.aether.core.events;

/**
 * Fired when the acknowledgement window for one attempt of a command closes.
 * Ignored if the command was acknowledged or re-sent in the meantime.
 */
public record CommandDeadline(
    String agentId,
    long timestamp,
    String commandId,
    int attempt
) implements AgentEvent {}
