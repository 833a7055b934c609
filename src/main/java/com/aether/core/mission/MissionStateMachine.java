package com.aether.core.mission;

import com.aether.core.events.CommandAck;
import com.aether.core.events.CommandDeadline;
import com.aether.core.geo.GeoMath;
import com.aether.core.model.AbortReason;
import com.aether.core.model.AgentSnapshot;
import com.aether.core.model.CommandType;
import com.aether.core.model.GeoPoint;
import com.aether.core.model.MissionExecution;
import com.aether.core.model.MissionMetrics;
import com.aether.core.model.MissionPhase;
import com.aether.core.model.MissionPlan;
import com.aether.core.model.PendingCommand;
import com.aether.core.model.RouteStep;
import com.aether.core.safety.Breach;
import com.aether.core.safety.SafetyValidator;
import com.aether.core.safety.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lifecycle of one mission: DRAFT, VALIDATING, EXECUTING, then COMPLETED or ABORTED.
 * <p>
 * Owned and driven exclusively by one entity actor, so it is not thread-safe. All time
 * comes from the event timestamps passed in, which keeps replay deterministic. Once a
 * terminal phase is reached every further input is ignored.
 */
public class MissionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(MissionStateMachine.class);

    private final String missionId;
    private final String agentId;
    private final MissionPlan plan;
    private final boolean observed;
    private final MissionSettings settings;
    private final SafetyValidator validator;
    private final MissionContext context;

    private MissionPhase phase;
    private int currentStepIndex;
    private Long startTime;
    private Long endTime;
    private AbortReason abortReason;
    private String detail;
    private boolean suspended;
    private Double batteryAtStart;
    private GeoPoint lastPosition;
    private final Deque<CommandType> commandQueue = new ArrayDeque<>();
    private PendingCommand pendingCommand;

    private double distanceFlown;
    private double maxAltitude;
    private double batteryConsumed;
    private long durationMs;
    private int waypointsReached;

    public MissionStateMachine(String missionId, String agentId, MissionPlan plan, boolean observed,
                               MissionSettings settings, SafetyValidator validator, MissionContext context) {
        this.missionId = missionId;
        this.agentId = agentId;
        this.plan = plan;
        this.observed = observed;
        this.settings = settings;
        this.validator = validator;
        this.context = context;
        this.phase = MissionPhase.DRAFT;
    }

    /**
     * Rebuild a machine from a checkpointed execution record. No commands are sent;
     * the owning actor re-arms outstanding deadlines once replay has finished.
     */
    public static MissionStateMachine restore(MissionExecution execution, MissionSettings settings,
                                              SafetyValidator validator, MissionContext context) {
        var machine = new MissionStateMachine(execution.missionId(), execution.agentId(), execution.plan(),
                execution.observed(), settings, validator, context);
        machine.phase = execution.phase();
        machine.currentStepIndex = execution.currentStepIndex();
        machine.startTime = execution.startTime();
        machine.endTime = execution.endTime();
        machine.abortReason = execution.abortReason();
        machine.detail = execution.detail();
        machine.suspended = execution.suspended();
        machine.batteryAtStart = execution.batteryAtStart();
        machine.lastPosition = execution.lastPosition();
        machine.commandQueue.addAll(execution.commandQueue());
        machine.pendingCommand = execution.pendingCommand();
        MissionMetrics metrics = execution.metrics();
        machine.distanceFlown = metrics.distanceFlownMeters();
        machine.maxAltitude = metrics.maxAltitudeMeters();
        machine.batteryConsumed = metrics.batteryConsumedPercent();
        machine.durationMs = metrics.durationMs();
        machine.waypointsReached = metrics.waypointsReached();
        return machine;
    }

    /**
     * DRAFT to VALIDATING. A failed check aborts the mission with VALIDATION_FAILURE,
     * so it never reaches EXECUTING.
     */
    public ValidationResult validate(AgentSnapshot agent, long timestamp) {
        requirePhase(MissionPhase.DRAFT);
        phase = MissionPhase.VALIDATING;
        ValidationResult result = observed ? ValidationResult.ok() : validator.validate(plan, agent);
        if (!result.isValid()) {
            log.info("Mission {} failed validation: {}", missionId, result.reason());
            terminate(MissionPhase.ABORTED, AbortReason.VALIDATION_FAILURE, result.reason(), timestamp);
        }
        return result;
    }

    /**
     * VALIDATING to EXECUTING. Assigned missions upload the plan, then start it;
     * observed sessions issue no commands.
     */
    public void start(AgentSnapshot agent, long timestamp) {
        requirePhase(MissionPhase.VALIDATING);
        phase = MissionPhase.EXECUTING;
        startTime = timestamp;
        batteryAtStart = agent.battery();
        lastPosition = agent.position();
        if (lastPosition != null) {
            maxAltitude = lastPosition.altitude();
        }
        log.info("Mission {} executing on agent {} ({} steps{})",
                missionId, agentId, plan.route().size(), observed ? ", observed" : "");
        if (!observed) {
            commandQueue.add(CommandType.UPLOAD_MISSION);
            commandQueue.add(CommandType.START_MISSION);
            sendNext(timestamp);
        }
    }

    /**
     * Fold one telemetry sample into the execution: accumulate metrics, advance the
     * route and re-check in-flight constraints.
     *
     * @param previous agent state before the sample
     * @param current  agent state after the sample
     */
    public void onTelemetry(AgentSnapshot previous, AgentSnapshot current, long timestamp) {
        if (phase != MissionPhase.EXECUTING || suspended) {
            return;
        }
        accumulate(current, timestamp);
        if (observed) {
            return;
        }

        advanceRoute(current.position());
        if (previous.armed() && !current.armed()) {
            if (onlyLandRemains()) {
                currentStepIndex = plan.route().size();
                complete(timestamp);
            } else {
                abort(AbortReason.UNEXPECTED_DISARM,
                        "disarmed at step %d of %d".formatted(currentStepIndex, plan.route().size()),
                        timestamp, null);
            }
            return;
        }
        if (currentStepIndex >= plan.route().size()) {
            complete(timestamp);
            return;
        }

        Optional<Breach> breach = validator.checkInFlight(plan, current, timestamp - startTime);
        breach.ifPresent(b -> abort(AbortReason.CONSTRAINT_BREACH, b.detail(), timestamp, b.directive()));
    }

    /**
     * @return true if the acknowledgement belonged to this mission's outstanding command
     */
    public boolean onCommandAck(CommandAck ack) {
        if (pendingCommand == null || !pendingCommand.commandId().equals(ack.commandId())) {
            return false;
        }
        if (phase != MissionPhase.EXECUTING) {
            return true;
        }
        if (!ack.accepted()) {
            log.warn("Command {} rejected by agent {}", ack.commandId(), agentId);
            failedAttempt(ack.timestamp());
            return true;
        }
        log.debug("Command {} acknowledged", ack.commandId());
        pendingCommand = null;
        if (!suspended) {
            sendNext(ack.timestamp());
        }
        return true;
    }

    /**
     * @return true if the deadline belonged to this mission's outstanding command
     */
    public boolean onCommandDeadline(CommandDeadline deadline) {
        if (pendingCommand == null
                || !pendingCommand.commandId().equals(deadline.commandId())
                || pendingCommand.attempt() != deadline.attempt()) {
            return false;
        }
        if (phase == MissionPhase.EXECUTING && !suspended) {
            failedAttempt(deadline.timestamp());
        }
        return true;
    }

    /**
     * Force the mission to ABORTED. No-op once terminal.
     *
     * @param recovery directive to send the vehicle, or null for none
     * @return true if this call ended the mission
     */
    public boolean abort(AbortReason reason, String detail, long timestamp, CommandType recovery) {
        if (phase.isTerminal()) {
            return false;
        }
        pendingCommand = null;
        commandQueue.clear();
        terminate(MissionPhase.ABORTED, reason, detail, timestamp);
        if (recovery != null) {
            Map<String, Object> params = recovery == CommandType.RETURN_TO_LAUNCH && plan.emergencyRallyPoint() != null
                    ? Map.of("rally_point", plan.emergencyRallyPoint())
                    : Map.of();
            context.sendRecovery(missionId,
                    new PendingCommand(missionId + ":" + recovery.name(), recovery, params, 1), timestamp);
        }
        return true;
    }

    /** End an EXECUTING mission successfully. */
    public void complete(long timestamp) {
        if (phase == MissionPhase.EXECUTING) {
            terminate(MissionPhase.COMPLETED, null, null, timestamp);
        }
    }

    /** Park the mission while its agent is disconnected. */
    public void suspend(long timestamp) {
        if (phase == MissionPhase.EXECUTING && !suspended) {
            suspended = true;
            log.info("Mission {} suspended at step {}", missionId, currentStepIndex);
        }
    }

    /**
     * Resume after reconnection. A command that was outstanding when the link dropped
     * is sent again as a new attempt.
     */
    public void resume(long timestamp) {
        if (!suspended) {
            return;
        }
        suspended = false;
        log.info("Mission {} resumed at step {}", missionId, currentStepIndex);
        if (phase == MissionPhase.EXECUTING && pendingCommand != null) {
            pendingCommand = pendingCommand.nextAttempt();
            context.sendCommand(missionId, pendingCommand, timestamp);
        }
    }

    public MissionExecution export() {
        return new MissionExecution(missionId, agentId, plan, phase, currentStepIndex, startTime, endTime,
                new MissionMetrics(distanceFlown, maxAltitude, batteryConsumed, durationMs, waypointsReached),
                abortReason, detail, observed, suspended, batteryAtStart, lastPosition,
                List.copyOf(commandQueue), pendingCommand);
    }

    public String missionId() { return missionId; }
    public MissionPhase phase() { return phase; }
    public boolean isTerminal() { return phase.isTerminal(); }
    public boolean isObserved() { return observed; }
    public boolean isSuspended() { return suspended; }
    public PendingCommand pendingCommand() { return pendingCommand; }
    public AbortReason abortReason() { return abortReason; }

    private void sendNext(long timestamp) {
        CommandType next = commandQueue.poll();
        if (next == null) {
            return;
        }
        Map<String, Object> params = next == CommandType.UPLOAD_MISSION
                ? Map.of("plan_id", String.valueOf(plan.planId()), "steps", plan.route().size())
                : Map.of();
        pendingCommand = new PendingCommand(missionId + ":" + next.name(), next, params, 1);
        context.sendCommand(missionId, pendingCommand, timestamp);
    }

    private void failedAttempt(long timestamp) {
        if (pendingCommand.attempt() <= settings.commandMaxRetries()) {
            pendingCommand = pendingCommand.nextAttempt();
            log.info("Retrying {} for mission {} (attempt {})",
                    pendingCommand.type(), missionId, pendingCommand.attempt());
            context.commandRetried(pendingCommand.type());
            context.sendCommand(missionId, pendingCommand, timestamp);
            return;
        }
        CommandType type = pendingCommand.type();
        abort(AbortReason.COMMAND_TIMEOUT,
                "%s not acknowledged after %d attempts".formatted(type, pendingCommand.attempt()),
                timestamp, CommandType.RETURN_TO_LAUNCH);
    }

    private void accumulate(AgentSnapshot current, long timestamp) {
        GeoPoint position = current.position();
        if (position != null) {
            if (lastPosition != null) {
                distanceFlown += GeoMath.distanceMeters(lastPosition, position);
            }
            maxAltitude = Math.max(maxAltitude, position.altitude());
            lastPosition = position;
        }
        if (batteryAtStart != null && current.battery() != null) {
            batteryConsumed = Math.max(0.0, batteryAtStart - current.battery());
        } else if (batteryAtStart == null) {
            batteryAtStart = current.battery();
        }
        durationMs = timestamp - startTime;
    }

    private void advanceRoute(GeoPoint position) {
        List<RouteStep> route = plan.route();
        double tolerance = settings.waypointToleranceMeters();
        while (currentStepIndex < route.size()) {
            RouteStep step = route.get(currentStepIndex);
            boolean reached;
            if (step instanceof RouteStep.Takeoff takeoff) {
                reached = position != null && position.altitude() >= takeoff.altitude() - tolerance;
            } else if (step instanceof RouteStep.Waypoint waypoint) {
                reached = position != null && GeoMath.distance3dMeters(position, waypoint.target()) <= tolerance;
                if (reached) {
                    waypointsReached++;
                }
            } else if (step instanceof RouteStep.Action action) {
                log.debug("Mission {} performing action {}", missionId, action.action());
                reached = true;
            } else {
                // LAND completes on disarm
                reached = false;
            }
            if (!reached) {
                return;
            }
            currentStepIndex++;
            log.debug("Mission {} reached step {} of {}", missionId, currentStepIndex, route.size());
        }
    }

    private boolean onlyLandRemains() {
        List<RouteStep> route = plan.route();
        return currentStepIndex == route.size() - 1 && route.get(currentStepIndex) instanceof RouteStep.Land;
    }

    private void terminate(MissionPhase terminal, AbortReason reason, String detail, long timestamp) {
        phase = terminal;
        abortReason = reason;
        this.detail = detail;
        endTime = timestamp;
        if (startTime != null) {
            durationMs = timestamp - startTime;
        }
        suspended = false;
        if (terminal == MissionPhase.ABORTED) {
            log.warn("Mission {} aborted: {} ({})", missionId, reason, detail);
        } else {
            log.info("Mission {} completed after {} ms", missionId, durationMs);
        }
    }

    private void requirePhase(MissionPhase expected) {
        if (phase != expected) {
            throw new IllegalStateException("Mission " + missionId + " is " + phase + ", expected " + expected);
        }
    }
}
