package com.aether.core.events;

public record ConnectivityChange(
    String agentId,
    long timestamp,
    boolean connected
) implements AgentEvent {}
