package com.aether.core.model;

import java.io.Serializable;
import java.util.Set;

/**
 * Capabilities fixed at enrollment.
 *
 * @param sensors            sensor identifiers carried by the airframe (e.g. "lidar", "thermal")
 * @param maxRangeMeters     furthest distance from its current position the agent may be sent; null when unknown
 * @param payloadCapacityKg  payload it can lift; null when unknown
 * @param serviceArea        operating region label used by dispatch filters; may be null
 * @param detectionProfile   name of the session detection profile for this agent's tenant; null selects the default
 */
public record AgentAttributes(
    Set<String> sensors,
    Double maxRangeMeters,
    Double payloadCapacityKg,
    String serviceArea,
    String detectionProfile
) implements Serializable {

    public AgentAttributes {
        sensors = sensors == null ? Set.of() : Set.copyOf(sensors);
    }

    public boolean hasSensors(Set<String> required) {
        return required == null || sensors.containsAll(required);
    }
}
