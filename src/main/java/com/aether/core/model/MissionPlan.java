package com.aether.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Immutable mission document produced by the planner collaborator.
 * Validated but never mutated by the core.
 */
public record MissionPlan(
    @JsonProperty("plan_id") String planId,
    MissionConstraints constraints,
    Geofence geofence,
    List<RouteStep> route,
    @JsonProperty("emergency_rally_point") GeoPoint emergencyRallyPoint
) implements Serializable {

    public MissionPlan {
        constraints = constraints == null ? MissionConstraints.none() : constraints;
        route = route == null ? List.of() : List.copyOf(route);
    }

    /**
     * Plan attached to a session the detection engine confirmed on its own:
     * nothing to fly, nothing to enforce.
     */
    public static MissionPlan observedSession() {
        return new MissionPlan("observed", MissionConstraints.none(), null, List.of(), null);
    }
}
