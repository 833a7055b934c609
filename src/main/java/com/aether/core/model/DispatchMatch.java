package com.aether.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Best candidate for a dispatch query. {@code distanceMeters} is null when the
 * query had no reference point or the agent has no known position.
 */
public record DispatchMatch(
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("distance_meters") Double distanceMeters
) {}
