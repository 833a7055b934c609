package com.aether.core.events;

/**
 * Transport acknowledgement (or rejection) of an outbound command, fed back into the
 * owning actor's mailbox so acknowledgements are processed in order with everything else.
 */
public record CommandAck(
    String agentId,
    long timestamp,
    String commandId,
    boolean accepted
) implements AgentEvent {}
