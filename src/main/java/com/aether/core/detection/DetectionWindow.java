package com.aether.core.detection;

import com.aether.core.model.GeoPoint;

import java.io.Serializable;

/**
 * What the detection engine remembers about the current candidate or confirmed session.
 *
 * @param startTimestamp  when the agent was first seen armed
 * @param startPosition   position at arming; null until a sample with a fix arrives
 * @param disarmedSince   first timestamp of the current disarm streak, null while armed
 */
public record DetectionWindow(
    long startTimestamp,
    GeoPoint startPosition,
    Long disarmedSince
) implements Serializable {

    public static DetectionWindow openedAt(long timestamp, GeoPoint position) {
        return new DetectionWindow(timestamp, position, null);
    }

    public DetectionWindow withStartPosition(GeoPoint position) {
        return new DetectionWindow(startTimestamp, position, disarmedSince);
    }

    public DetectionWindow withDisarmedSince(Long since) {
        return new DetectionWindow(startTimestamp, startPosition, since);
    }
}
