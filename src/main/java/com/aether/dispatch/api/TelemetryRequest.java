package com.aether.dispatch.api;

import com.aether.core.events.TelemetryKind;
import com.aether.core.events.TelemetryUpdate;
import com.aether.core.model.GeoPoint;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/agents/{id}/telemetry. Omitted fields are
 * "not reported" and leave the agent's values unchanged.
 *
 * @param timestamp epoch millis at the vehicle; nullable, defaults to receipt time
 */
public record TelemetryRequest(
    Long timestamp,
    TelemetryKind kind,
    GeoPoint position,
    Double battery,
    Boolean armed,
    @JsonProperty("gps_fix") Integer gpsFix,
    @JsonProperty("wind_speed") Double windSpeed,
    String fault
) {

    TelemetryUpdate toEvent(String agentId, long receivedAt) {
        return new TelemetryUpdate(agentId, timestamp != null ? timestamp : receivedAt, kind,
                position, battery, armed, gpsFix, windSpeed, fault);
    }
}
