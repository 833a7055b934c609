package com.aether.core.model;

public enum StepType {
    TAKEOFF,
    WAYPOINT,
    ACTION,
    LAND
}
