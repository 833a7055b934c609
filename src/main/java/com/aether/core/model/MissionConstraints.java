package com.aether.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Set;

/**
 * Pre-flight and in-flight limits attached to a plan. Null fields are not enforced.
 */
public record MissionConstraints(
    @JsonProperty("min_battery_start") Double minBatteryStart,
    @JsonProperty("min_battery_reserve") Double minBatteryReserve,
    @JsonProperty("max_wind_speed") Double maxWindSpeed,
    @JsonProperty("max_duration_seconds") Long maxDurationSeconds,
    @JsonProperty("required_sensors") Set<String> requiredSensors,
    @JsonProperty("payload_kg") Double payloadKg
) implements Serializable {

    public MissionConstraints {
        requiredSensors = requiredSensors == null ? Set.of() : Set.copyOf(requiredSensors);
    }

    public static MissionConstraints none() {
        return new MissionConstraints(null, null, null, null, Set.of(), null);
    }
}
