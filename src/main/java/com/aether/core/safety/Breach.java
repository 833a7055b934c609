package com.aether.core.safety;

import com.aether.core.model.CommandType;

/**
 * An in-flight constraint the agent has crossed.
 *
 * @param directive recovery command to issue to the vehicle
 */
public record Breach(Kind kind, String detail, CommandType directive) {

    public enum Kind { GEOFENCE, ALTITUDE, BATTERY, WIND, DURATION }
}
