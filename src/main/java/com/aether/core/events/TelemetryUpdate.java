package com.aether.core.events;

import com.aether.core.model.GeoPoint;

/**
 * Structured telemetry delta, already decoded upstream from the vehicle wire format.
 * Null fields mean "not reported in this sample" and leave the agent's value unchanged.
 *
 * @param armed   TRUE/FALSE when the sample reports arming state, null otherwise
 * @param gpsFix  fix type (0 none, 2 = 2D, 3 = 3D, higher = DGPS/RTK)
 * @param fault   hardware fault description; non-null forces the agent into ERROR
 */
public record TelemetryUpdate(
    String agentId,
    long timestamp,
    TelemetryKind kind,
    GeoPoint position,
    Double battery,
    Boolean armed,
    Integer gpsFix,
    Double windSpeed,
    String fault
) implements AgentEvent {

    public TelemetryUpdate {
        kind = kind == null ? TelemetryKind.HEARTBEAT : kind;
    }

    public static TelemetryUpdate position(String agentId, long timestamp, GeoPoint position,
                                           double battery, boolean armed, int gpsFix) {
        return new TelemetryUpdate(agentId, timestamp, TelemetryKind.POSITION,
                position, battery, armed, gpsFix, null, null);
    }

    public boolean reportsFault() {
        return kind == TelemetryKind.FAULT || fault != null;
    }
}
