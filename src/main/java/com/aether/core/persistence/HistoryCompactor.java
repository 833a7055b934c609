package com.aether.core.persistence;

import com.aether.core.archive.MissionArchive;
import com.aether.core.config.AetherProperties;
import com.aether.core.metrics.AetherMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Bounds each agent's event log by checkpointing its actor and truncating the events
 * the checkpoint already reflects.
 * <p>
 * Actors call {@link #maybeCompact} between two processed events. When a trigger is due
 * (enough events since the last checkpoint, or the interval has passed with events
 * pending) the checkpoint is captured right there, on the actor's thread, and persisted
 * asynchronously. At most one persist per agent is in flight. A failed persist leaves
 * the segment untouched and the next trigger tries again; repeated failures raise an
 * operational alert but never stop the actor.
 */
@Service
public class HistoryCompactor {

    private static final Logger log = LoggerFactory.getLogger(HistoryCompactor.class);

    private final HistoryStore store;
    private final MissionArchive archive;
    private final AetherMetrics metrics;
    private final Clock clock;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final int everyEvents;
    private final long intervalMs;
    private final int alertThreshold;

    private final ConcurrentHashMap<String, AgentCompaction> agents = new ConcurrentHashMap<>();

    @Autowired
    public HistoryCompactor(HistoryStore store, MissionArchive archive, AetherMetrics metrics,
                            Clock clock, AetherProperties properties) {
        this(store, archive, metrics, clock, properties, newCompactionExecutor());
    }

    public HistoryCompactor(HistoryStore store, MissionArchive archive, AetherMetrics metrics,
                     Clock clock, AetherProperties properties, Executor executor) {
        this.store = store;
        this.archive = archive;
        this.metrics = metrics;
        this.clock = clock;
        this.executor = executor;
        this.ownedExecutor = executor instanceof ExecutorService service ? service : null;
        this.everyEvents = Math.max(1, properties.getHistory().getCompactEveryEvents());
        this.intervalMs = properties.getHistory().getCompactIntervalSeconds() * 1000;
        this.alertThreshold = Math.max(1, properties.getHistory().getFailureAlertThreshold());
    }

    /**
     * Start tracking an agent whose latest durable checkpoint is at {@code checkpointSequence}.
     */
    public void track(String agentId, long checkpointSequence) {
        agents.put(agentId, new AgentCompaction(checkpointSequence, clock.millis()));
    }

    /**
     * Stop tracking an agent. Blocks until a persist already running for it has finished;
     * a persist that starts later writes nothing, so history deleted after this returns
     * stays deleted.
     */
    public void forget(String agentId) {
        AgentCompaction state = agents.remove(agentId);
        if (state == null) {
            return;
        }
        synchronized (state) {
            state.retired = true;
        }
    }

    /**
     * Called by an actor between events. Captures and persists a checkpoint if a trigger is due.
     *
     * @param sequence sequence of the last event the actor has applied
     * @param capture  produces the actor's checkpoint; invoked only on the calling thread
     * @return true if a compaction was started
     */
    public boolean maybeCompact(String agentId, long sequence, Supplier<EntityCheckpoint> capture) {
        AgentCompaction state = agents.get(agentId);
        if (state == null) {
            return false;
        }
        long pending = sequence - state.checkpointSequence;
        if (pending <= 0) {
            return false;
        }
        boolean countDue = pending >= everyEvents;
        boolean intervalDue = intervalMs > 0 && clock.millis() - state.lastAttemptAt >= intervalMs;
        if (!countDue && !intervalDue) {
            return false;
        }
        if (!state.inFlight.compareAndSet(false, true)) {
            return false;
        }

        EntityCheckpoint checkpoint;
        try {
            checkpoint = capture.get();
        } catch (RuntimeException e) {
            state.inFlight.set(false);
            log.warn("Could not capture checkpoint for agent {}: {}", agentId, e.getMessage(), e);
            return false;
        }
        try {
            executor.execute(() -> persist(agentId, state, checkpoint));
        } catch (RuntimeException e) {
            state.inFlight.set(false);
            log.warn("Compaction for agent {} could not be scheduled: {}", agentId, e.getMessage());
            return false;
        }
        return true;
    }

    /**
     * Agents whose consecutive compaction failures reached the alert threshold.
     */
    public List<String> degradedAgents() {
        return agents.entrySet().stream()
                .filter(e -> e.getValue().consecutiveFailures >= alertThreshold)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    public int consecutiveFailures(String agentId) {
        AgentCompaction state = agents.get(agentId);
        return state == null ? 0 : state.consecutiveFailures;
    }

    private void persist(String agentId, AgentCompaction state, EntityCheckpoint checkpoint) {
        synchronized (state) {
            if (state.retired) {
                log.debug("Skipping compaction for retired agent {}", agentId);
                state.inFlight.set(false);
                return;
            }
            persistTracked(agentId, state, checkpoint);
        }
    }

    private void persistTracked(String agentId, AgentCompaction state, EntityCheckpoint checkpoint) {
        long start = clock.millis();
        try {
            store.saveCheckpoint(checkpoint);
            state.checkpointSequence = checkpoint.sequence();

            HistorySegment superseded = store.readSegment(agentId, checkpoint.sequence());
            archive.archiveSegment(superseded);
            int removed = store.truncateThrough(agentId, checkpoint.sequence());

            state.consecutiveFailures = 0;
            long elapsed = clock.millis() - start;
            metrics.recordCompaction(elapsed);
            log.info("Compacted agent {} at sequence {} ({} events retired, {} ms)",
                    agentId, checkpoint.sequence(), removed, elapsed);
        } catch (RuntimeException e) {
            state.consecutiveFailures++;
            metrics.recordCompactionFailure();
            if (state.consecutiveFailures >= alertThreshold) {
                log.error("ALERT: compaction for agent {} failed {} times in a row; history keeps growing: {}",
                        agentId, state.consecutiveFailures, e.getMessage(), e);
            } else {
                log.warn("Compaction for agent {} failed, keeping segment for retry: {}",
                        agentId, e.getMessage());
            }
        } finally {
            state.lastAttemptAt = clock.millis();
            state.inFlight.set(false);
        }
    }

    @PreDestroy
    void shutdown() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ExecutorService newCompactionExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "aether-compactor");
            t.setDaemon(true);
            return t;
        });
    }

    private static final class AgentCompaction {
        private final AtomicBoolean inFlight = new AtomicBoolean();
        private volatile long checkpointSequence;
        private volatile long lastAttemptAt;
        private volatile int consecutiveFailures;
        private boolean retired;

        private AgentCompaction(long checkpointSequence, long lastAttemptAt) {
            this.checkpointSequence = checkpointSequence;
            this.lastAttemptAt = lastAttemptAt;
        }
    }
}
