package com.aether.core.detection;

import java.time.Duration;

/**
 * Per-tenant thresholds for deciding when an armed agent is really on a mission.
 *
 * @param minDuration     how long the agent must stay armed before a session is confirmed
 * @param minDistance     how far (metres) it must have moved from the session's reference point
 * @param requireGpsLock  whether confirmation needs a 3D fix
 * @param disarmTimeout   how long a disarm must persist before the session is declared over
 */
public record DetectionProfile(
    Duration minDuration,
    double minDistance,
    boolean requireGpsLock,
    Duration disarmTimeout
) {

    public static final int GPS_3D_FIX = 3;

    public static DetectionProfile defaults() {
        return new DetectionProfile(Duration.ofSeconds(30), 10.0, true, Duration.ZERO);
    }
}
