package com.aether.core.mission;

/**
 * Tuning shared by every mission an actor runs.
 *
 * @param commandAckTimeoutMs  how long one command attempt may wait for its acknowledgement
 * @param commandMaxRetries    re-sends allowed after the first attempt before the mission aborts
 * @param waypointToleranceMeters 3D distance at which a waypoint counts as reached
 */
public record MissionSettings(
    long commandAckTimeoutMs,
    int commandMaxRetries,
    double waypointToleranceMeters
) {}
