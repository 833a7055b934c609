package com.aether.core.detection;

import com.aether.core.events.TelemetryUpdate;
import com.aether.core.geo.GeoMath;
import com.aether.core.model.AgentLifecycleState;
import com.aether.core.model.AgentSnapshot;
import com.aether.core.model.GeoPoint;
import org.springframework.stereotype.Service;

/**
 * Classifies session boundaries from an agent's telemetry.
 * <p>
 * Pure: the result depends only on the agent snapshot (already updated with the
 * sample), the window carried over from the previous evaluation, the sample and the
 * profile. The entity actor owns the window and stores it in its checkpoints.
 */
@Service
public class DetectionRuleEngine {

    /**
     * Evaluate one telemetry sample.
     *
     * @param agent   agent state after the sample has been applied
     * @param window  current window; must be non-null while the agent is ONLINE_ARMED
     * @param sample  the telemetry being processed
     * @param profile thresholds for the agent's tenant
     */
    public DetectionResult evaluate(AgentSnapshot agent, DetectionWindow window,
                                    TelemetryUpdate sample, DetectionProfile profile) {
        if (agent.lifecycleState() == AgentLifecycleState.ONLINE_ARMED) {
            return evaluateCandidate(agent, window, sample, profile);
        }
        if (agent.lifecycleState() == AgentLifecycleState.IN_MISSION) {
            return evaluateSession(window, sample, profile);
        }
        return DetectionResult.keep(window);
    }

    private DetectionResult evaluateCandidate(AgentSnapshot agent, DetectionWindow window,
                                              TelemetryUpdate sample, DetectionProfile profile) {
        // Partial updates (armed == null) say nothing about arming
        if (Boolean.FALSE.equals(sample.armed())) {
            return new DetectionResult(DetectionDecision.REVERT_FALSE_START, null);
        }
        if (window == null) {
            window = DetectionWindow.openedAt(sample.timestamp(), sample.position());
        }

        GeoPoint reference = window.startPosition();
        if (reference == null) {
            if (agent.homePosition() != null) {
                reference = agent.homePosition();
            } else if (sample.position() != null) {
                // Armed before the first fix: the first fixed sample becomes the start point
                return DetectionResult.keep(window.withStartPosition(sample.position()));
            } else {
                return DetectionResult.keep(window);
            }
        }

        long elapsed = sample.timestamp() - window.startTimestamp();
        if (elapsed < profile.minDuration().toMillis()) {
            return DetectionResult.keep(window);
        }
        if (profile.requireGpsLock() && agent.gpsFix() < DetectionProfile.GPS_3D_FIX) {
            return DetectionResult.keep(window);
        }
        GeoPoint current = sample.position() != null ? sample.position() : agent.position();
        if (current == null || GeoMath.distanceMeters(reference, current) < profile.minDistance()) {
            return DetectionResult.keep(window);
        }
        return new DetectionResult(DetectionDecision.CONFIRM_SESSION_START, window);
    }

    private DetectionResult evaluateSession(DetectionWindow window, TelemetryUpdate sample,
                                            DetectionProfile profile) {
        if (window == null) {
            window = DetectionWindow.openedAt(sample.timestamp(), sample.position());
        }
        if (Boolean.TRUE.equals(sample.armed())) {
            return DetectionResult.keep(window.disarmedSince() == null ? window : window.withDisarmedSince(null));
        }
        if (!Boolean.FALSE.equals(sample.armed())) {
            return DetectionResult.keep(window);
        }
        long since = window.disarmedSince() != null ? window.disarmedSince() : sample.timestamp();
        if (sample.timestamp() - since >= profile.disarmTimeout().toMillis()) {
            return new DetectionResult(DetectionDecision.CONFIRM_SESSION_END, null);
        }
        return DetectionResult.keep(window.withDisarmedSince(since));
    }
}
