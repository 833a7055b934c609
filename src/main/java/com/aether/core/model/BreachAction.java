package com.aether.core.model;

/**
 * What the vehicle is told to do when it leaves its geofence.
 */
public enum BreachAction {
    RETURN_TO_LAUNCH,
    LAND,
    HOLD
}
