package com.aether.dispatch.api;

import com.aether.core.model.AgentAttributes;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * Inbound JSON body for POST /api/v1/agents.
 *
 * @param agentId           unique vehicle identifier
 * @param sensors           sensor identifiers carried by the airframe
 * @param maxRangeMeters    nullable; unknown range disables range filters for this agent
 * @param payloadCapacityKg nullable
 * @param serviceArea       nullable operating region label
 * @param detectionProfile  nullable; selects the tenant's session detection thresholds
 */
public record EnrollRequest(
    @JsonProperty("agent_id") String agentId,
    Set<String> sensors,
    @JsonProperty("max_range_meters") Double maxRangeMeters,
    @JsonProperty("payload_capacity_kg") Double payloadCapacityKg,
    @JsonProperty("service_area") String serviceArea,
    @JsonProperty("detection_profile") String detectionProfile
) {

    AgentAttributes toAttributes() {
        return new AgentAttributes(sensors, maxRangeMeters, payloadCapacityKg, serviceArea, detectionProfile);
    }
}
