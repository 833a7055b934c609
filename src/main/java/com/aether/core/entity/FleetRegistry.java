package com.aether.core.entity;

import com.aether.core.archive.MissionArchive;
import com.aether.core.config.AetherProperties;
import com.aether.core.detection.DetectionRuleEngine;
import com.aether.core.events.AgentEvent;
import com.aether.core.events.EventBus;
import com.aether.core.events.OperatorSignal;
import com.aether.core.fleet.FleetIndex;
import com.aether.core.metrics.AetherMetrics;
import com.aether.core.mission.CommandGateway;
import com.aether.core.mission.MissionStatusService;
import com.aether.core.model.AgentAttributes;
import com.aether.core.model.AgentSnapshot;
import com.aether.core.model.AssignmentResult;
import com.aether.core.model.MissionPlan;
import com.aether.core.persistence.EntityCheckpoint;
import com.aether.core.persistence.HistoryCompactor;
import com.aether.core.persistence.HistoryStore;
import com.aether.core.persistence.HistoryStoreException;
import com.aether.core.persistence.LoggedEvent;
import com.aether.core.planner.PlannerGateway;
import com.aether.core.safety.SafetyValidator;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the set of live entity actors: enrolls and decommissions agents, rehydrates them
 * from history at startup and offers synchronous wrappers around the signal API.
 * <p>
 * Signals still travel through the {@link EventBus}, so per-agent ordering holds no
 * matter which entry point a caller uses. Synchronous calls wait at most the configured
 * signal timeout and fail with {@link SignalTimeoutException} instead of blocking.
 */
@Service
public class FleetRegistry {

    private static final Logger log = LoggerFactory.getLogger(FleetRegistry.class);

    private final EventBus eventBus;
    private final EntityEnvironment env;
    private final ConcurrentHashMap<String, RegisteredActor> actors = new ConcurrentHashMap<>();

    public FleetRegistry(EventBus eventBus, HistoryStore history, HistoryCompactor compactor, FleetIndex fleetIndex,
                         MissionStatusService missionStatus, MissionArchive archive, CommandGateway commandGateway,
                         PlannerGateway planner, SafetyValidator validator, DetectionRuleEngine detection,
                         AetherMetrics metrics, ActorScheduler scheduler, Clock clock, AetherProperties properties) {
        this(eventBus, new EntityEnvironment(history, compactor, fleetIndex, missionStatus, archive, commandGateway,
                planner, validator, detection, metrics, scheduler, clock, properties));
    }

    FleetRegistry(EventBus eventBus, EntityEnvironment env) {
        this.eventBus = eventBus;
        this.env = env;
    }

    @PostConstruct
    void start() {
        if (!env.properties().getRuntime().isEnabled()) {
            log.info("Agent runtime disabled; no actors started");
            return;
        }
        eventBus.subscribeAll(event -> env.metrics().recordEventReceived(event.eventName()));
        rehydrateAll();
        long intervalMs = env.properties().getHistory().getCompactIntervalSeconds() * 1000;
        if (intervalMs > 0) {
            env.scheduler().scheduleAtFixedRate(this::requestCompactions, intervalMs);
        }
    }

    /**
     * Rebuild every agent found in the history store from its latest checkpoint plus
     * the events recorded after it.
     *
     * @return number of agents brought back
     */
    public int rehydrateAll() {
        int restored = 0;
        for (String agentId : env.history().listAgentIds()) {
            if (actors.containsKey(agentId)) {
                continue;
            }
            Optional<EntityCheckpoint> checkpoint;
            List<LoggedEvent> tail;
            try {
                checkpoint = env.history().loadLatestCheckpoint(agentId);
                if (checkpoint.isEmpty()) {
                    log.warn("Agent {} has history but no checkpoint; skipping", agentId);
                    continue;
                }
                tail = env.history().readEventsAfter(agentId, checkpoint.get().sequence());
            } catch (HistoryStoreException e) {
                log.error("Could not read history for agent {}; not rehydrated", agentId, e);
                continue;
            }
            EntityStateMachine actor = EntityStateMachine.rehydrate(checkpoint.get(), tail, env);
            activate(actor, checkpoint.get().sequence());
            actor.resumeTimers();
            restored++;
        }
        log.info("Rehydrated {} agents", restored);
        return restored;
    }

    /**
     * Create the actor for a new agent. The agent starts OFFLINE and its initial
     * checkpoint is persisted before this returns.
     *
     * @throws AgentAlreadyEnrolledException if the id is taken
     */
    public synchronized AgentSnapshot enroll(String agentId, AgentAttributes attributes) {
        if (actors.containsKey(agentId) || env.history().loadLatestCheckpoint(agentId).isPresent()) {
            throw new AgentAlreadyEnrolledException(agentId);
        }
        EntityStateMachine actor = new EntityStateMachine(agentId,
                attributes != null ? attributes : new AgentAttributes(null, null, null, null, null), env);
        EntityCheckpoint initial = actor.captureCheckpoint();
        env.history().saveCheckpoint(initial);
        activate(actor, initial.sequence());
        log.info("Enrolled agent {}", agentId);
        return actor.snapshot();
    }

    /**
     * Abort any mission the agent holds, stop its actor and delete its history.
     */
    public synchronized void decommission(String agentId) {
        RegisteredActor registered = actors.remove(agentId);
        if (registered == null) {
            throw new UnknownAgentException(agentId);
        }
        registered.subscription().unsubscribe();
        await(registered.actor().decommission(), agentId);
        env.compactor().forget(agentId);
        env.fleetIndex().remove(agentId);
        env.history().deleteAgent(agentId);
    }

    public Optional<AgentSnapshot> query(String agentId) {
        RegisteredActor registered = actors.get(agentId);
        return registered == null ? Optional.empty() : Optional.of(registered.actor().snapshot());
    }

    public AgentSnapshot require(String agentId) {
        return query(agentId).orElseThrow(() -> new UnknownAgentException(agentId));
    }

    public List<AgentSnapshot> list() {
        return actors.values().stream()
                .map(r -> r.actor().snapshot())
                .sorted(Comparator.comparing(AgentSnapshot::agentId))
                .toList();
    }

    public boolean isEnrolled(String agentId) {
        return actors.containsKey(agentId);
    }

    /**
     * Assign a plan under a freshly generated mission id and wait for the outcome.
     */
    public AssignmentResult assign(String agentId, MissionPlan plan) {
        var signal = new OperatorSignal.AssignMission(agentId, now(), generateMissionId(), plan);
        return (AssignmentResult) await(eventBus.request(signal), agentId);
    }

    /**
     * Store a proposed plan as a draft awaiting operator approval.
     *
     * @return the draft id
     */
    public String proposePlan(String agentId, String draftId, MissionPlan plan) {
        String id = draftId != null ? draftId : "DRF-" + UUID.randomUUID().toString().substring(0, 8);
        await(eventBus.request(new OperatorSignal.ProposePlan(agentId, now(), id, plan)), agentId);
        return id;
    }

    public AssignmentResult approvePlan(String agentId, String draftId) {
        var signal = new OperatorSignal.ApprovePlan(agentId, now(), draftId, generateMissionId());
        return (AssignmentResult) await(eventBus.request(signal), agentId);
    }

    /**
     * @return false if the agent had no such draft
     */
    public boolean rejectPlan(String agentId, String draftId, String feedback) {
        return (Boolean) await(eventBus.request(new OperatorSignal.RejectPlan(agentId, now(), draftId, feedback)), agentId);
    }

    public AgentSnapshot emergencyStop(String agentId) {
        return (AgentSnapshot) await(eventBus.request(new OperatorSignal.EmergencyStop(agentId, now())), agentId);
    }

    public AgentSnapshot clearError(String agentId) {
        return (AgentSnapshot) await(eventBus.request(new OperatorSignal.ClearError(agentId, now())), agentId);
    }

    /**
     * Deliver an event and wait until it has been applied.
     *
     * @return the agent's state after the event
     */
    public AgentSnapshot ingest(AgentEvent event) {
        await(eventBus.request(event), event.agentId());
        return require(event.agentId());
    }

    /**
     * Generates a unique mission ID in the format MSN-YYYY-XXXXXXXX.
     */
    public String generateMissionId() {
        int year = env.clock().instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("MSN-%d-%s", year, UUID.randomUUID().toString().substring(0, 8).toUpperCase());
    }

    private void activate(EntityStateMachine actor, long checkpointSequence) {
        EventBus.Subscription subscription = eventBus.register(actor.agentId(), actor::offer);
        actors.put(actor.agentId(), new RegisteredActor(actor, subscription));
        env.compactor().track(actor.agentId(), checkpointSequence);
        env.fleetIndex().publish(actor.snapshot());
    }

    private void requestCompactions() {
        actors.values().forEach(r -> r.actor().requestCompaction());
    }

    private long now() {
        return env.clock().millis();
    }

    private Object await(CompletableFuture<Object> reply, String agentId) {
        long timeoutMs = env.properties().getMission().getSignalTimeoutMs();
        try {
            return reply.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new SignalTimeoutException("Agent " + agentId + " did not answer within " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Signal to agent " + agentId + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SignalTimeoutException("Interrupted waiting for agent " + agentId, e);
        }
    }

    private record RegisteredActor(EntityStateMachine actor, EventBus.Subscription subscription) {}
}
