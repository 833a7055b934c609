package com.aether.core.model;

import java.io.Serializable;

/**
 * Flight metrics accumulated while a mission executes.
 */
public record MissionMetrics(
    double distanceFlownMeters,
    double maxAltitudeMeters,
    double batteryConsumedPercent,
    long durationMs,
    int waypointsReached
) implements Serializable {

    public static MissionMetrics empty() {
        return new MissionMetrics(0.0, 0.0, 0.0, 0L, 0);
    }
}
