package com.aether.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Inclusion fence for a mission.
 *
 * @param polygon      vertices in order; fewer than three means "no horizontal fence"
 * @param maxAltitude  ceiling in metres; null for none
 * @param breachAction directive issued on a fence breach; defaults to RTL
 */
public record Geofence(
    List<GeoPoint> polygon,
    @JsonProperty("max_altitude") Double maxAltitude,
    @JsonProperty("breach_action") BreachAction breachAction
) implements Serializable {

    public Geofence {
        polygon = polygon == null ? List.of() : List.copyOf(polygon);
        breachAction = breachAction == null ? BreachAction.RETURN_TO_LAUNCH : breachAction;
    }

    public boolean hasPolygon() {
        return polygon.size() >= 3;
    }
}
