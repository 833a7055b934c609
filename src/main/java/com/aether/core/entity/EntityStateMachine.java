package com.aether.core.entity;

import com.aether.core.detection.DetectionDecision;
import com.aether.core.detection.DetectionProfile;
import com.aether.core.detection.DetectionResult;
import com.aether.core.detection.DetectionWindow;
import com.aether.core.events.AgentEvent;
import com.aether.core.events.CommandAck;
import com.aether.core.events.CommandDeadline;
import com.aether.core.events.ConnectivityChange;
import com.aether.core.events.ConnectivityGraceExpired;
import com.aether.core.events.OperatorSignal;
import com.aether.core.events.TelemetryKind;
import com.aether.core.events.TelemetryUpdate;
import com.aether.core.logging.MdcContext;
import com.aether.core.mission.AgentCommand;
import com.aether.core.mission.MissionContext;
import com.aether.core.mission.MissionSettings;
import com.aether.core.mission.MissionStateMachine;
import com.aether.core.model.AbortReason;
import com.aether.core.model.AgentAttributes;
import com.aether.core.model.AgentLifecycleState;
import com.aether.core.model.AgentSnapshot;
import com.aether.core.model.AssignmentResult;
import com.aether.core.model.CommandType;
import com.aether.core.model.GeoPoint;
import com.aether.core.model.MissionPhase;
import com.aether.core.model.MissionPlan;
import com.aether.core.model.PendingCommand;
import com.aether.core.persistence.EntityCheckpoint;
import com.aether.core.persistence.HistoryStoreException;
import com.aether.core.persistence.LoggedEvent;
import com.aether.core.safety.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The actor that owns one agent.
 * <p>
 * Events arrive in a priority mailbox and are processed one at a time: each is first
 * appended to the agent's history, then applied, then the resulting state is committed
 * as an immutable {@link AgentSnapshot} and published to the fleet index. Readers only
 * ever see committed snapshots, so {@link #snapshot()} never waits on processing.
 * <p>
 * All decisions use event timestamps. Timers and transport acknowledgements come back
 * as events through the same mailbox, so replaying the history after a checkpoint
 * rebuilds exactly the same state. Side effects (commands, timers, planner feedback,
 * metrics) are suppressed while replaying.
 */
public class EntityStateMachine {

    private static final Logger log = LoggerFactory.getLogger(EntityStateMachine.class);

    private final String agentId;
    private final EntityEnvironment env;
    private final MissionSettings missionSettings;
    private final DetectionProfile detectionProfile;
    private final MissionContext missionContext = new MissionSideEffects();

    private final PriorityBlockingQueue<Envelope> mailbox = new PriorityBlockingQueue<>();
    private final AtomicLong arrivals = new AtomicLong();
    private final AtomicBoolean draining = new AtomicBoolean();
    private volatile AgentSnapshot committed;
    private volatile boolean stopped;

    // Confined to the thread currently draining the mailbox
    private final AgentAttributes attributes;
    private AgentLifecycleState state = AgentLifecycleState.OFFLINE;
    private GeoPoint position;
    private GeoPoint homePosition;
    private Double battery;
    private boolean armed;
    private int gpsFix;
    private Double windSpeed;
    private boolean connected;
    private String fault;
    private long lastTelemetryTimestamp;
    private long sequence;

    private MissionStateMachine activeMission;
    private MissionStateMachine suspendedMission;
    private Long graceDeadline;
    private DetectionWindow detectionWindow;
    private final Map<String, MissionPlan> drafts = new LinkedHashMap<>();
    private PendingCommand recoveryCommand;
    private boolean replaying;

    public EntityStateMachine(String agentId, AgentAttributes attributes, EntityEnvironment env) {
        this.agentId = agentId;
        this.attributes = attributes;
        this.env = env;
        this.missionSettings = env.missionSettings();
        this.detectionProfile = env.properties().detectionProfile(attributes.detectionProfile());
        this.committed = snapshotState();
    }

    /**
     * Rebuild an actor from its latest checkpoint and the events logged after it.
     * The actor is not started; call {@link #resumeTimers()} once it is registered.
     */
    public static EntityStateMachine rehydrate(EntityCheckpoint checkpoint, List<LoggedEvent> tail,
                                               EntityEnvironment env) {
        var actor = new EntityStateMachine(checkpoint.agentId(), checkpoint.agent().attributes(), env);
        actor.restore(checkpoint);
        actor.replaying = true;
        try {
            for (LoggedEvent logged : tail) {
                actor.sequence = logged.sequence();
                try {
                    actor.apply(logged.event());
                } catch (RuntimeException e) {
                    log.warn("Replay of {} #{} failed for agent {}: {}",
                            logged.event().eventName(), logged.sequence(), actor.agentId, e.getMessage());
                }
            }
        } finally {
            actor.replaying = false;
        }
        actor.commit();
        log.info("Rehydrated agent {} from checkpoint {} plus {} events ({})",
                actor.agentId, checkpoint.sequence(), tail.size(), actor.state);
        return actor;
    }

    public String agentId() {
        return agentId;
    }

    /** Most recently committed state. Never blocks. */
    public AgentSnapshot snapshot() {
        return committed;
    }

    /**
     * Enqueue an event. The returned future completes with the handler's reply once the
     * event has been processed, or exceptionally if it could not be recorded or applied.
     */
    public CompletableFuture<Object> offer(AgentEvent event) {
        if (stopped) {
            return CompletableFuture.failedFuture(new UnknownAgentException(agentId));
        }
        return enqueue(Envelope.of(event, arrivals.incrementAndGet()));
    }

    /**
     * Ask for a compaction check between events, used by the interval trigger.
     */
    public void requestCompaction() {
        submitControl(this::maybeCompact);
    }

    /**
     * Abort whatever mission the agent holds, archive it and stop accepting events.
     */
    public CompletableFuture<Object> decommission() {
        return submitControl(() -> {
            long now = env.clock().millis();
            if (activeMission != null) {
                activeMission.abort(AbortReason.DECOMMISSIONED, "agent decommissioned", now, null);
                archive(activeMission);
                activeMission = null;
            }
            if (suspendedMission != null) {
                suspendedMission.abort(AbortReason.DECOMMISSIONED, "agent decommissioned", now, null);
                archive(suspendedMission);
                suspendedMission = null;
            }
            stopped = true;
            Envelope rest;
            while ((rest = mailbox.poll()) != null) {
                rest.reply().completeExceptionally(new UnknownAgentException(agentId));
            }
            log.info("Agent {} decommissioned", agentId);
        });
    }

    /**
     * Re-arm the timers of outstanding work after rehydration: acknowledgement deadlines
     * for unacknowledged commands and the grace deadline of a suspended mission.
     */
    public void resumeTimers() {
        submitControl(() -> {
            long now = env.clock().millis();
            if (activeMission != null && !activeMission.isSuspended() && activeMission.pendingCommand() != null) {
                armDeadline(activeMission.pendingCommand(), now);
            }
            if (recoveryCommand != null) {
                armDeadline(recoveryCommand, now);
            }
            if (suspendedMission != null && graceDeadline != null) {
                armGrace(suspendedMission.missionId(), graceDeadline);
            }
        });
    }

    /**
     * Durable state as of the last processed event. Must run on the actor's thread.
     */
    EntityCheckpoint captureCheckpoint() {
        return new EntityCheckpoint(agentId, sequence, env.clock().instant(), snapshotState(),
                activeMission != null ? activeMission.export() : null,
                suspendedMission != null ? suspendedMission.export() : null,
                graceDeadline, detectionWindow, new LinkedHashMap<>(drafts), recoveryCommand);
    }

    // ── Mailbox ───────────────────────────────────────────────────────────

    private CompletableFuture<Object> submitControl(Runnable task) {
        if (stopped) {
            return CompletableFuture.failedFuture(new UnknownAgentException(agentId));
        }
        return enqueue(Envelope.control(task, arrivals.incrementAndGet()));
    }

    private CompletableFuture<Object> enqueue(Envelope envelope) {
        mailbox.add(envelope);
        // Decommission may have drained the mailbox between the caller's check and the add
        if (stopped) {
            mailbox.remove(envelope);
            envelope.reply().completeExceptionally(new UnknownAgentException(agentId));
            return envelope.reply();
        }
        scheduleDrain();
        return envelope.reply();
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            env.scheduler().execute(this::drain);
        }
    }

    private void drain() {
        try {
            Envelope envelope;
            while (!stopped && (envelope = mailbox.poll()) != null) {
                process(envelope);
            }
        } finally {
            draining.set(false);
            if (!stopped && !mailbox.isEmpty()) {
                scheduleDrain();
            }
        }
    }

    private void process(Envelope envelope) {
        if (envelope.isControl()) {
            MdcContext.setAgent(agentId);
            try {
                envelope.control().run();
                envelope.reply().complete(null);
            } catch (RuntimeException e) {
                log.error("Control task failed for agent {}", agentId, e);
                envelope.reply().completeExceptionally(e);
            } finally {
                MdcContext.clear();
            }
            return;
        }

        AgentEvent event = envelope.event();
        MdcContext.setMission(agentId, currentMissionId());
        try {
            long next = sequence + 1;
            env.history().appendEvent(agentId, next, event);
            sequence = next;
            Object reply;
            try {
                reply = apply(event);
            } finally {
                commit();
            }
            env.metrics().recordEvent(event.eventName());
            envelope.reply().complete(reply);
        } catch (HistoryStoreException e) {
            log.error("Could not record {} for agent {}; event rejected", event.eventName(), agentId, e);
            envelope.reply().completeExceptionally(e);
        } catch (RuntimeException e) {
            log.error("Handler for {} failed on agent {}", event.eventName(), agentId, e);
            env.metrics().recordEventFailure(event.eventName());
            envelope.reply().completeExceptionally(e);
        } finally {
            MdcContext.clear();
        }
        maybeCompact();
    }

    private void maybeCompact() {
        env.compactor().maybeCompact(agentId, sequence, this::captureCheckpoint);
    }

    private void commit() {
        AgentSnapshot snapshot = snapshotState();
        committed = snapshot;
        env.fleetIndex().publish(snapshot);
        if (activeMission != null) {
            env.missionStatus().update(activeMission.export());
        }
        if (suspendedMission != null) {
            env.missionStatus().update(suspendedMission.export());
        }
    }

    // ── Event handling ────────────────────────────────────────────────────

    Object apply(AgentEvent event) {
        if (event instanceof TelemetryUpdate telemetry) {
            onTelemetry(telemetry);
        } else if (event instanceof ConnectivityChange change) {
            onConnectivity(change);
        } else if (event instanceof OperatorSignal.AssignMission assign) {
            return assign(assign.missionId(), assign.plan(), assign.timestamp());
        } else if (event instanceof OperatorSignal.ProposePlan propose) {
            drafts.put(propose.draftId(), propose.plan());
            log.info("Draft {} stored for agent {}", propose.draftId(), agentId);
        } else if (event instanceof OperatorSignal.ApprovePlan approve) {
            return approve(approve);
        } else if (event instanceof OperatorSignal.RejectPlan reject) {
            return reject(reject);
        } else if (event instanceof OperatorSignal.EmergencyStop stop) {
            onEmergencyStop(stop.timestamp());
        } else if (event instanceof OperatorSignal.ClearError) {
            onClearError();
        } else if (event instanceof CommandAck ack) {
            onCommandAck(ack);
        } else if (event instanceof CommandDeadline deadline) {
            onCommandDeadline(deadline);
        } else if (event instanceof ConnectivityGraceExpired expired) {
            onGraceExpired(expired);
        } else {
            log.warn("Agent {} ignoring unsupported event {}", agentId, event.eventName());
        }
        return snapshotState();
    }

    private void onTelemetry(TelemetryUpdate sample) {
        if (sample.timestamp() < lastTelemetryTimestamp) {
            log.debug("Dropping stale telemetry at {} (last {})", sample.timestamp(), lastTelemetryTimestamp);
            return;
        }
        AgentSnapshot before = snapshotState();
        lastTelemetryTimestamp = sample.timestamp();
        if (sample.kind() == TelemetryKind.HOME_POSITION) {
            if (sample.position() != null) {
                homePosition = sample.position();
            }
        } else if (sample.position() != null) {
            position = sample.position();
        }
        if (sample.battery() != null) {
            battery = sample.battery();
        }
        if (sample.armed() != null) {
            armed = sample.armed();
        }
        if (sample.gpsFix() != null) {
            gpsFix = sample.gpsFix();
        }
        if (sample.windSpeed() != null) {
            windSpeed = sample.windSpeed();
        }

        if (sample.reportsFault()) {
            enterError(sample.fault() != null ? sample.fault() : "fault reported", sample.timestamp());
            return;
        }

        switch (state) {
            case ONLINE_IDLE -> {
                if (Boolean.TRUE.equals(sample.armed())) {
                    // The start point is the arming sample's own fix; without one the
                    // engine falls back to home or the next fixed sample
                    detectionWindow = DetectionWindow.openedAt(sample.timestamp(), sample.position());
                    transition(AgentLifecycleState.ONLINE_ARMED);
                }
            }
            case ONLINE_ARMED -> evaluateCandidate(sample);
            case IN_MISSION -> {
                MissionPhase phaseBefore = activeMission.phase();
                activeMission.onTelemetry(before, snapshotState(), sample.timestamp());
                settleMission(phaseBefore, sample.timestamp());
                if (activeMission != null && (activeMission.isTerminal() || activeMission.isObserved())) {
                    DetectionResult result = env.detection().evaluate(snapshotState(), detectionWindow,
                            sample, detectionProfile);
                    detectionWindow = result.window();
                    if (result.decision() == DetectionDecision.CONFIRM_SESSION_END) {
                        endSession(sample.timestamp());
                    }
                }
            }
            default -> {
                // OFFLINE and ERROR only track the reported values
            }
        }
    }

    private void evaluateCandidate(TelemetryUpdate sample) {
        DetectionResult result = env.detection().evaluate(snapshotState(), detectionWindow, sample, detectionProfile);
        detectionWindow = result.window();
        if (result.decision() == DetectionDecision.REVERT_FALSE_START) {
            log.info("False start on agent {}: disarmed before session confirmed", agentId);
            if (!replaying) {
                env.metrics().recordFalseStart();
            }
            transition(AgentLifecycleState.ONLINE_IDLE);
        } else if (result.decision() == DetectionDecision.CONFIRM_SESSION_START) {
            String missionId = agentId + "-S" + sequence;
            MissionStateMachine session = newMission(missionId, MissionPlan.observedSession(), true);
            session.validate(snapshotState(), sample.timestamp());
            activeMission = session;
            transition(AgentLifecycleState.IN_MISSION);
            session.start(snapshotState(), sample.timestamp());
            log.info("Session {} confirmed on agent {}", missionId, agentId);
        }
    }

    private void onConnectivity(ConnectivityChange change) {
        long now = change.timestamp();
        if (!change.connected()) {
            connected = false;
            if (state == AgentLifecycleState.OFFLINE) {
                return;
            }
            if (activeMission != null) {
                if (activeMission.isTerminal()) {
                    archive(activeMission);
                } else {
                    activeMission.suspend(now);
                    suspendedMission = activeMission;
                    graceDeadline = now + env.connectivityGraceMs();
                    armGrace(suspendedMission.missionId(), graceDeadline);
                    log.warn("Agent {} lost connectivity; mission {} suspended until {}",
                            agentId, suspendedMission.missionId(), graceDeadline);
                }
                activeMission = null;
            }
            detectionWindow = null;
            transition(AgentLifecycleState.OFFLINE);
            return;
        }

        connected = true;
        if (state != AgentLifecycleState.OFFLINE) {
            return;
        }
        if (suspendedMission != null) {
            activeMission = suspendedMission;
            suspendedMission = null;
            graceDeadline = null;
            transition(AgentLifecycleState.IN_MISSION);
            activeMission.resume(now);
            log.info("Agent {} reconnected; mission {} resumed", agentId, activeMission.missionId());
        } else {
            fault = null;
            transition(AgentLifecycleState.ONLINE_IDLE);
        }
    }

    private void onGraceExpired(ConnectivityGraceExpired expired) {
        if (suspendedMission == null || graceDeadline == null
                || !suspendedMission.missionId().equals(expired.missionId())
                || expired.timestamp() < graceDeadline) {
            return;
        }
        suspendedMission.abort(AbortReason.CONNECTIVITY_TIMEOUT,
                "no reconnection within %d s".formatted(env.properties().getMission().getConnectivityGraceSeconds()),
                expired.timestamp(), null);
        missionEnded(suspendedMission);
        archive(suspendedMission);
        suspendedMission = null;
        graceDeadline = null;
    }

    private AssignmentResult assign(String missionId, MissionPlan plan, long timestamp) {
        AssignmentResult result;
        if (state == AgentLifecycleState.IN_MISSION) {
            result = AssignmentResult.busy();
        } else if (state == AgentLifecycleState.OFFLINE) {
            result = AssignmentResult.unreachable();
        } else if (state == AgentLifecycleState.ERROR) {
            result = AssignmentResult.violation("agent is in ERROR: " + fault);
        } else {
            MissionStateMachine mission = newMission(missionId, plan, false);
            ValidationResult validation = mission.validate(snapshotState(), timestamp);
            if (!validation.isValid()) {
                missionEnded(mission);
                archive(mission);
                result = AssignmentResult.violation(validation.reason());
            } else {
                activeMission = mission;
                detectionWindow = null;
                transition(AgentLifecycleState.IN_MISSION);
                mission.start(snapshotState(), timestamp);
                result = AssignmentResult.accepted(missionId);
            }
        }
        log.info("Assignment {} to agent {}: {}{}", missionId, agentId, result.outcome(),
                result.reason() != null ? " (" + result.reason() + ")" : "");
        if (!replaying) {
            env.metrics().recordAssignment(result.outcome());
        }
        return result;
    }

    private AssignmentResult approve(OperatorSignal.ApprovePlan approve) {
        MissionPlan plan = drafts.get(approve.draftId());
        if (plan == null) {
            return AssignmentResult.violation("unknown draft " + approve.draftId());
        }
        AssignmentResult result = assign(approve.missionId(), plan, approve.timestamp());
        if (result.isAccepted()) {
            drafts.remove(approve.draftId());
        }
        return result;
    }

    private Boolean reject(OperatorSignal.RejectPlan reject) {
        MissionPlan removed = drafts.remove(reject.draftId());
        if (removed == null) {
            return false;
        }
        if (!replaying) {
            env.planner().submitFeedback(agentId, reject.draftId(), reject.feedback());
        }
        return true;
    }

    private void onEmergencyStop(long timestamp) {
        if (activeMission != null && !activeMission.isTerminal()) {
            MissionPhase phaseBefore = activeMission.phase();
            log.warn("Emergency stop on agent {}: aborting mission {}", agentId, activeMission.missionId());
            activeMission.abort(AbortReason.EMERGENCY_STOP, "emergency stop", timestamp, CommandType.RETURN_TO_LAUNCH);
            settleMission(phaseBefore, timestamp);
        } else if (suspendedMission != null) {
            log.warn("Emergency stop on agent {}: aborting suspended mission {}", agentId, suspendedMission.missionId());
            suspendedMission.abort(AbortReason.EMERGENCY_STOP, "emergency stop", timestamp, null);
            missionEnded(suspendedMission);
            archive(suspendedMission);
            suspendedMission = null;
            graceDeadline = null;
        } else {
            log.info("Emergency stop on agent {} with no executing mission", agentId);
        }
    }

    private void onClearError() {
        if (state == AgentLifecycleState.ERROR) {
            fault = null;
            transition(AgentLifecycleState.ONLINE_IDLE);
        }
    }

    private void onCommandAck(CommandAck ack) {
        if (recoveryCommand != null && recoveryCommand.commandId().equals(ack.commandId())) {
            if (ack.accepted()) {
                log.info("Recovery {} acknowledged by agent {}", recoveryCommand.type(), agentId);
                recoveryCommand = null;
            } else {
                retryRecovery(ack.timestamp());
            }
            return;
        }
        if (activeMission != null) {
            MissionPhase phaseBefore = activeMission.phase();
            activeMission.onCommandAck(ack);
            settleMission(phaseBefore, ack.timestamp());
        }
    }

    private void onCommandDeadline(CommandDeadline deadline) {
        if (recoveryCommand != null && recoveryCommand.commandId().equals(deadline.commandId())) {
            if (recoveryCommand.attempt() == deadline.attempt()) {
                retryRecovery(deadline.timestamp());
            }
            return;
        }
        if (activeMission != null) {
            MissionPhase phaseBefore = activeMission.phase();
            activeMission.onCommandDeadline(deadline);
            settleMission(phaseBefore, deadline.timestamp());
        }
    }

    private void retryRecovery(long timestamp) {
        if (recoveryCommand.attempt() <= missionSettings.commandMaxRetries()) {
            recoveryCommand = recoveryCommand.nextAttempt();
            if (!replaying) {
                env.metrics().recordCommandRetry(recoveryCommand.type());
                dispatch(recoveryCommand, timestamp);
            }
            return;
        }
        log.error("Recovery {} for agent {} not acknowledged after {} attempts",
                recoveryCommand.type(), agentId, recoveryCommand.attempt());
        recoveryCommand = null;
    }

    private void enterError(String reportedFault, long timestamp) {
        fault = reportedFault;
        if (state == AgentLifecycleState.ERROR) {
            return;
        }
        log.error("Agent {} reported fault: {}", agentId, reportedFault);
        if (activeMission != null) {
            if (activeMission.abort(AbortReason.AGENT_FAULT, reportedFault, timestamp, CommandType.RETURN_TO_LAUNCH)) {
                missionEnded(activeMission);
            }
            archive(activeMission);
            activeMission = null;
        }
        if (suspendedMission != null) {
            suspendedMission.abort(AbortReason.AGENT_FAULT, reportedFault, timestamp, null);
            missionEnded(suspendedMission);
            archive(suspendedMission);
            suspendedMission = null;
            graceDeadline = null;
        }
        detectionWindow = null;
        transition(AgentLifecycleState.ERROR);
    }

    /**
     * Bookkeeping after the active mission has handled an input. A mission that just
     * ended on a disarmed agent releases the agent right away; otherwise the agent stays
     * IN_MISSION until the detection engine confirms the disarm.
     */
    private void settleMission(MissionPhase phaseBefore, long timestamp) {
        if (activeMission == null || phaseBefore.isTerminal() || !activeMission.isTerminal()) {
            return;
        }
        missionEnded(activeMission);
        if (!armed) {
            DetectionWindow window = detectionWindow != null
                    ? detectionWindow
                    : DetectionWindow.openedAt(timestamp, position);
            detectionWindow = window.withDisarmedSince(timestamp);
            if (detectionProfile.disarmTimeout().isZero()) {
                endSession(timestamp);
            }
        }
    }

    private void endSession(long timestamp) {
        if (activeMission == null) {
            return;
        }
        if (activeMission.isObserved() && !activeMission.isTerminal()) {
            activeMission.complete(timestamp);
            missionEnded(activeMission);
        }
        if (!activeMission.isTerminal()) {
            return;
        }
        log.info("Session {} on agent {} closed", activeMission.missionId(), agentId);
        archive(activeMission);
        activeMission = null;
        detectionWindow = null;
        transition(AgentLifecycleState.ONLINE_IDLE);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private MissionStateMachine newMission(String missionId, MissionPlan plan, boolean observed) {
        return new MissionStateMachine(missionId, agentId, plan, observed, missionSettings,
                env.validator(), missionContext);
    }

    private void missionEnded(MissionStateMachine mission) {
        if (!replaying) {
            env.metrics().recordMissionResult(mission.phase(), mission.abortReason());
        }
    }

    private void archive(MissionStateMachine mission) {
        env.archive().archive(mission.export());
        env.missionStatus().remove(mission.missionId());
    }

    private void transition(AgentLifecycleState to) {
        if (state == to) {
            return;
        }
        AgentLifecycleState from = state;
        state = to;
        log.info("Agent {} {} -> {}", agentId, from, to);
        if (!replaying) {
            env.metrics().recordTransition(from, to);
        }
    }

    private void dispatch(PendingCommand command, long timestamp) {
        String missionId = command.commandId().substring(0, command.commandId().lastIndexOf(':'));
        armDeadline(command, timestamp);
        CompletableFuture<Void> sent;
        try {
            sent = env.commandGateway().send(new AgentCommand(agentId, missionId, command.commandId(),
                    command.type(), command.params(), command.attempt()));
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        sent.whenComplete((ok, error) -> {
            if (error != null) {
                log.warn("Command {} to agent {} failed: {}", command.commandId(), agentId, error.getMessage());
            }
            offer(new CommandAck(agentId, env.clock().millis(), command.commandId(), error == null));
        });
    }

    private void armDeadline(PendingCommand command, long fromTimestamp) {
        long due = fromTimestamp + missionSettings.commandAckTimeoutMs();
        CommandDeadline deadline = new CommandDeadline(agentId, due, command.commandId(), command.attempt());
        env.scheduler().schedule(() -> offer(deadline), due - env.clock().millis());
    }

    private void armGrace(String missionId, long deadline) {
        if (replaying) {
            return;
        }
        ConnectivityGraceExpired expired = new ConnectivityGraceExpired(agentId, deadline, missionId);
        env.scheduler().schedule(() -> offer(expired), deadline - env.clock().millis());
    }

    private String currentMissionId() {
        return activeMission != null ? activeMission.missionId() : null;
    }

    private AgentSnapshot snapshotState() {
        return new AgentSnapshot(agentId, attributes, state, position, homePosition, battery, armed, gpsFix,
                windSpeed, connected,
                activeMission != null ? activeMission.missionId() : null,
                suspendedMission != null ? suspendedMission.missionId() : null,
                fault, lastTelemetryTimestamp, sequence);
    }

    private void restore(EntityCheckpoint checkpoint) {
        AgentSnapshot agent = checkpoint.agent();
        state = agent.lifecycleState();
        position = agent.position();
        homePosition = agent.homePosition();
        battery = agent.battery();
        armed = agent.armed();
        gpsFix = agent.gpsFix();
        windSpeed = agent.windSpeed();
        connected = agent.connected();
        fault = agent.fault();
        lastTelemetryTimestamp = agent.lastTelemetryTimestamp();
        sequence = checkpoint.sequence();
        activeMission = checkpoint.activeMission() != null
                ? MissionStateMachine.restore(checkpoint.activeMission(), missionSettings, env.validator(), missionContext)
                : null;
        suspendedMission = checkpoint.suspendedMission() != null
                ? MissionStateMachine.restore(checkpoint.suspendedMission(), missionSettings, env.validator(), missionContext)
                : null;
        graceDeadline = checkpoint.graceDeadline();
        detectionWindow = checkpoint.detection();
        drafts.clear();
        drafts.putAll(checkpoint.drafts());
        recoveryCommand = checkpoint.recoveryCommand();
    }

    /**
     * Routes mission side effects through the actor, which drops them during replay.
     */
    private final class MissionSideEffects implements MissionContext {

        @Override
        public void sendCommand(String missionId, PendingCommand command, long timestamp) {
            if (!replaying) {
                dispatch(command, timestamp);
            }
        }

        @Override
        public void sendRecovery(String missionId, PendingCommand command, long timestamp) {
            recoveryCommand = command;
            if (!replaying) {
                log.warn("Sending {} to agent {} for mission {}", command.type(), agentId, missionId);
                dispatch(command, timestamp);
            }
        }

        @Override
        public void commandRetried(CommandType type) {
            if (!replaying) {
                env.metrics().recordCommandRetry(type);
            }
        }
    }
}
