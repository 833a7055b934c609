package com.aether.core.model;

import java.io.Serializable;

/**
 * Immutable view of one agent's canonical state as last committed by its entity actor.
 * <p>
 * Published to the fleet index after every processed event and returned by state queries.
 * {@code activeMissionId} is non-null exactly when {@code lifecycleState} is {@code IN_MISSION}.
 *
 * @param sequence history sequence of the last event folded into this snapshot
 */
public record AgentSnapshot(
    String agentId,
    AgentAttributes attributes,
    AgentLifecycleState lifecycleState,
    GeoPoint position,
    GeoPoint homePosition,
    Double battery,
    boolean armed,
    int gpsFix,
    Double windSpeed,
    boolean connected,
    String activeMissionId,
    String suspendedMissionId,
    String fault,
    long lastTelemetryTimestamp,
    long sequence
) implements Serializable {

    public static AgentSnapshot enrolled(String agentId, AgentAttributes attributes) {
        return new AgentSnapshot(agentId, attributes, AgentLifecycleState.OFFLINE,
                null, null, null, false, 0, null, false,
                null, null, null, 0L, 0L);
    }

    public boolean hasActiveMission() {
        return activeMissionId != null;
    }
}
