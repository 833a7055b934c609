package com.aether.core.events;

/**
 * Fired when a mission parked by a disconnect has waited out its grace window.
 */
public record ConnectivityGraceExpired(
    String agentId,
    long timestamp,
    String missionId
) implements AgentEvent {}
