package com.aether.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.io.Serializable;
import java.util.Map;

/**
 * One typed step of a mission route. Plans arrive from an external planner, so each
 * variant is checked by {@link com.aether.core.safety.SafetyValidator} before a mission
 * may execute it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RouteStep.Takeoff.class, name = "TAKEOFF"),
        @JsonSubTypes.Type(value = RouteStep.Waypoint.class, name = "WAYPOINT"),
        @JsonSubTypes.Type(value = RouteStep.Action.class, name = "ACTION"),
        @JsonSubTypes.Type(value = RouteStep.Land.class, name = "LAND")
})
public interface RouteStep extends Serializable {

    StepType stepType();

    /** Climb to {@code altitude} metres above launch. */
    record Takeoff(double altitude) implements RouteStep {
        @Override
        public StepType stepType() { return StepType.TAKEOFF; }
    }

    /** Fly to {@code target}; reached when within the waypoint tolerance. */
    record Waypoint(GeoPoint target, Double speed) implements RouteStep {
        @Override
        public StepType stepType() { return StepType.WAYPOINT; }
    }

    /** Payload or camera action performed at the current position. */
    record Action(String action, Map<String, Object> params) implements RouteStep {
        public Action {
            params = params == null ? Map.of() : Map.copyOf(params);
        }

        @Override
        public StepType stepType() { return StepType.ACTION; }
    }

    /** Land at the current position; reached when the vehicle disarms. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Land() implements RouteStep {
        @Override
        public StepType stepType() { return StepType.LAND; }
    }
}
