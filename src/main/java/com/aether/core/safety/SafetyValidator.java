package com.aether.core.safety;

import com.aether.core.geo.GeoMath;
import com.aether.core.model.AgentLifecycleState;
import com.aether.core.model.AgentSnapshot;
import com.aether.core.model.CommandType;
import com.aether.core.model.GeoPoint;
import com.aether.core.model.Geofence;
import com.aether.core.model.MissionConstraints;
import com.aether.core.model.MissionPlan;
import com.aether.core.model.RouteStep;
import com.aether.core.model.StepType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates a plan's constraints against an agent snapshot.
 * <p>
 * Stateless and side-effect free: the same plan and snapshot always give the same
 * answer, which keeps validation replay-safe inside the entity actor.
 */
public class SafetyValidator {

    private final int minGpsFix;

    public SafetyValidator(int minGpsFix) {
        this.minGpsFix = minGpsFix;
    }

    /**
     * Pre-flight check run while a mission is VALIDATING.
     */
    public ValidationResult validate(MissionPlan plan, AgentSnapshot agent) {
        List<String> violations = new ArrayList<>(checkSchema(plan));
        if (!violations.isEmpty()) {
            return new ValidationResult(violations);
        }

        if (agent.lifecycleState() == AgentLifecycleState.ERROR) {
            violations.add("agent is in ERROR: " + agent.fault());
        }

        MissionConstraints constraints = plan.constraints();
        if (constraints.minBatteryStart() != null) {
            if (agent.battery() == null) {
                violations.add("battery level unknown");
            } else if (agent.battery() < constraints.minBatteryStart()) {
                violations.add("battery %.1f%% below required %.1f%%"
                        .formatted(agent.battery(), constraints.minBatteryStart()));
            }
        }
        if (!plan.route().isEmpty() && agent.gpsFix() < minGpsFix) {
            violations.add("gps fix %d below required %d".formatted(agent.gpsFix(), minGpsFix));
        }
        if (constraints.maxWindSpeed() != null && agent.windSpeed() != null
                && agent.windSpeed() > constraints.maxWindSpeed()) {
            violations.add("wind %.1f m/s exceeds limit %.1f m/s"
                    .formatted(agent.windSpeed(), constraints.maxWindSpeed()));
        }
        if (!agent.attributes().hasSensors(constraints.requiredSensors())) {
            Set<String> missing = new HashSet<>(constraints.requiredSensors());
            missing.removeAll(agent.attributes().sensors());
            violations.add("missing required sensors " + missing.stream().sorted().toList());
        }
        if (constraints.payloadKg() != null) {
            Double capacity = agent.attributes().payloadCapacityKg();
            if (capacity == null || capacity < constraints.payloadKg()) {
                violations.add("payload %.1f kg exceeds capacity %s"
                        .formatted(constraints.payloadKg(), capacity == null ? "unknown" : capacity + " kg"));
            }
        }

        violations.addAll(checkRouteAgainstFence(plan));
        violations.addAll(checkRange(plan, agent));
        return new ValidationResult(violations);
    }

    /**
     * In-flight check run on every telemetry sample while EXECUTING.
     *
     * @param elapsedMs time since the mission started executing
     * @return the first breached constraint, if any
     */
    public Optional<Breach> checkInFlight(MissionPlan plan, AgentSnapshot agent, long elapsedMs) {
        Geofence fence = plan.geofence();
        GeoPoint position = agent.position();
        if (fence != null && position != null) {
            CommandType directive = CommandType.forBreach(fence.breachAction());
            if (fence.hasPolygon() && !GeoMath.contains(fence.polygon(), position)) {
                return Optional.of(new Breach(Breach.Kind.GEOFENCE,
                        "position %.6f,%.6f outside geofence".formatted(position.latitude(), position.longitude()),
                        directive));
            }
            if (fence.maxAltitude() != null && position.altitude() > fence.maxAltitude()) {
                return Optional.of(new Breach(Breach.Kind.ALTITUDE,
                        "altitude %.1f m above ceiling %.1f m".formatted(position.altitude(), fence.maxAltitude()),
                        directive));
            }
        }

        MissionConstraints constraints = plan.constraints();
        if (constraints.minBatteryReserve() != null && agent.battery() != null
                && agent.battery() < constraints.minBatteryReserve()) {
            return Optional.of(new Breach(Breach.Kind.BATTERY,
                    "battery %.1f%% below reserve %.1f%%".formatted(agent.battery(), constraints.minBatteryReserve()),
                    CommandType.RETURN_TO_LAUNCH));
        }
        if (constraints.maxWindSpeed() != null && agent.windSpeed() != null
                && agent.windSpeed() > constraints.maxWindSpeed()) {
            return Optional.of(new Breach(Breach.Kind.WIND,
                    "wind %.1f m/s exceeds limit %.1f m/s".formatted(agent.windSpeed(), constraints.maxWindSpeed()),
                    CommandType.RETURN_TO_LAUNCH));
        }
        if (constraints.maxDurationSeconds() != null && elapsedMs > constraints.maxDurationSeconds() * 1000) {
            return Optional.of(new Breach(Breach.Kind.DURATION,
                    "mission exceeded %d s".formatted(constraints.maxDurationSeconds()),
                    CommandType.RETURN_TO_LAUNCH));
        }
        return Optional.empty();
    }

    /**
     * Structural checks on the externally authored route. A malformed plan is
     * rejected before any agent state is consulted.
     */
    List<String> checkSchema(MissionPlan plan) {
        List<String> problems = new ArrayList<>();
        List<RouteStep> route = plan.route();
        if (route.isEmpty()) {
            problems.add("route is empty");
        }
        for (int i = 0; i < route.size(); i++) {
            RouteStep step = route.get(i);
            if (step == null) {
                problems.add("step %d is null".formatted(i));
                continue;
            }
            if (step instanceof RouteStep.Takeoff takeoff && takeoff.altitude() <= 0) {
                problems.add("step %d: takeoff altitude must be positive".formatted(i));
            } else if (step instanceof RouteStep.Waypoint waypoint && waypoint.target() == null) {
                problems.add("step %d: waypoint has no target".formatted(i));
            } else if (step instanceof RouteStep.Action action
                    && (action.action() == null || action.action().isBlank())) {
                problems.add("step %d: action has no name".formatted(i));
            } else if (step.stepType() == StepType.LAND && i != route.size() - 1) {
                problems.add("step %d: land must be the last step".formatted(i));
            }
        }
        Geofence fence = plan.geofence();
        if (fence != null && !fence.polygon().isEmpty() && !fence.hasPolygon()) {
            problems.add("geofence polygon needs at least 3 vertices");
        }
        return problems;
    }

    private List<String> checkRouteAgainstFence(MissionPlan plan) {
        List<String> problems = new ArrayList<>();
        Geofence fence = plan.geofence();
        if (fence == null) {
            return problems;
        }
        List<RouteStep> route = plan.route();
        for (int i = 0; i < route.size(); i++) {
            if (route.get(i) instanceof RouteStep.Waypoint waypoint) {
                GeoPoint target = waypoint.target();
                if (fence.hasPolygon() && !GeoMath.contains(fence.polygon(), target)) {
                    problems.add("waypoint %d outside geofence".formatted(i));
                }
                if (fence.maxAltitude() != null && target.altitude() > fence.maxAltitude()) {
                    problems.add("waypoint %d altitude %.1f m above ceiling %.1f m"
                            .formatted(i, target.altitude(), fence.maxAltitude()));
                }
            } else if (route.get(i) instanceof RouteStep.Takeoff takeoff
                    && fence.maxAltitude() != null && takeoff.altitude() > fence.maxAltitude()) {
                problems.add("takeoff altitude %.1f m above ceiling %.1f m"
                        .formatted(takeoff.altitude(), fence.maxAltitude()));
            }
        }
        GeoPoint rally = plan.emergencyRallyPoint();
        if (rally != null && fence.hasPolygon() && !GeoMath.contains(fence.polygon(), rally)) {
            problems.add("emergency rally point outside geofence");
        }
        return problems;
    }

    private List<String> checkRange(MissionPlan plan, AgentSnapshot agent) {
        Double maxRange = agent.attributes().maxRangeMeters();
        GeoPoint origin = agent.position() != null ? agent.position() : agent.homePosition();
        if (maxRange == null || origin == null) {
            return List.of();
        }
        List<String> problems = new ArrayList<>();
        List<RouteStep> route = plan.route();
        for (int i = 0; i < route.size(); i++) {
            if (route.get(i) instanceof RouteStep.Waypoint waypoint) {
                double distance = GeoMath.distanceMeters(origin, waypoint.target());
                if (distance > maxRange) {
                    problems.add("waypoint %d is %.0f m away, beyond range %.0f m".formatted(i, distance, maxRange));
                }
            }
        }
        return problems;
    }
}
