package com.aether.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashSet;
import java.util.Set;

/**
 * Capability + proximity request answered against a point-in-time fleet index.
 *
 * @param requiredSensors   sensors every candidate must carry
 * @param requiredState     lifecycle state a candidate must be in; defaults to ONLINE_IDLE
 * @param serviceArea       exact service-area match; null disables the filter
 * @param reference         ranking point; null ranks by agent id only
 * @param minPayloadKg      minimum payload capacity; null disables the filter
 * @param minRangeMeters    minimum range; null disables the filter
 * @param excludedAgentIds  agents to skip, used when retrying after a lost race
 */
public record DispatchQuery(
    @JsonProperty("required_sensors") Set<String> requiredSensors,
    @JsonProperty("required_state") AgentLifecycleState requiredState,
    @JsonProperty("service_area") String serviceArea,
    GeoPoint reference,
    @JsonProperty("min_payload_kg") Double minPayloadKg,
    @JsonProperty("min_range_meters") Double minRangeMeters,
    @JsonProperty("excluded_agent_ids") Set<String> excludedAgentIds
) {

    public DispatchQuery {
        requiredSensors = requiredSensors == null ? Set.of() : Set.copyOf(requiredSensors);
        requiredState = requiredState == null ? AgentLifecycleState.ONLINE_IDLE : requiredState;
        excludedAgentIds = excludedAgentIds == null ? Set.of() : Set.copyOf(excludedAgentIds);
    }

    public static DispatchQuery idleWith(Set<String> sensors, GeoPoint reference) {
        return new DispatchQuery(sensors, AgentLifecycleState.ONLINE_IDLE, null, reference, null, null, Set.of());
    }

    public DispatchQuery excluding(String agentId) {
        var excluded = new HashSet<>(excludedAgentIds);
        excluded.add(agentId);
        return new DispatchQuery(requiredSensors, requiredState, serviceArea, reference,
                minPayloadKg, minRangeMeters, excluded);
    }
}
