package com.aether.core.geo;

import com.aether.core.model.GeoPoint;

import java.util.List;

/**
 * Great-circle distance and fence containment on WGS84 coordinates.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private GeoMath() {}

    /**
     * Haversine ground distance in metres, ignoring altitude.
     */
    public static double distanceMeters(GeoPoint a, GeoPoint b) {
        double phi1 = Math.toRadians(a.latitude());
        double phi2 = Math.toRadians(b.latitude());
        double dPhi = Math.toRadians(b.latitude() - a.latitude());
        double dLambda = Math.toRadians(b.longitude() - a.longitude());

        double h = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        return 2 * EARTH_RADIUS_METERS * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
    }

    /**
     * Straight-line distance combining ground distance and altitude difference.
     */
    public static double distance3dMeters(GeoPoint a, GeoPoint b) {
        double ground = distanceMeters(a, b);
        double vertical = b.altitude() - a.altitude();
        return Math.sqrt(ground * ground + vertical * vertical);
    }

    /**
     * Ray-casting point-in-polygon test on latitude/longitude. Points on an edge may
     * fall either way; fences are expected to carry a margin.
     */
    public static boolean contains(List<GeoPoint> polygon, GeoPoint point) {
        if (polygon == null || polygon.size() < 3) {
            return true;
        }
        boolean inside = false;
        double x = point.longitude();
        double y = point.latitude();
        for (int i = 0, j = polygon.size() - 1; i < polygon.size(); j = i++) {
            double xi = polygon.get(i).longitude();
            double yi = polygon.get(i).latitude();
            double xj = polygon.get(j).longitude();
            double yj = polygon.get(j).latitude();
            boolean crosses = (yi > y) != (yj > y)
                    && x < (xj - xi) * (y - yi) / (yj - yi) + xi;
            if (crosses) {
                inside = !inside;
            }
        }
        return inside;
    }

    /**
     * Point {@code northMeters} north and {@code eastMeters} east of {@code origin}; small-offset approximation.
     */
    public static GeoPoint offset(GeoPoint origin, double northMeters, double eastMeters) {
        double dLat = Math.toDegrees(northMeters / EARTH_RADIUS_METERS);
        double dLon = Math.toDegrees(eastMeters / (EARTH_RADIUS_METERS * Math.cos(Math.toRadians(origin.latitude()))));
        return new GeoPoint(origin.latitude() + dLat, origin.longitude() + dLon, origin.altitude());
    }
}
