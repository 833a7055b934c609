package com.aether.core.model;

import java.io.Serializable;

/**
 * A WGS84 position. Altitude is metres relative to the launch point.
 */
public record GeoPoint(
    double latitude,
    double longitude,
    double altitude
) implements Serializable {

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude, 0.0);
    }
}
