package com.aether.core.persistence;

import com.aether.core.events.AgentEvent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * {@link HistoryStore} held in memory. Suitable for development and tests;
 * nothing survives a restart.
 */
public class InMemoryHistoryStore implements HistoryStore {

    private final ConcurrentHashMap<String, ConcurrentSkipListMap<Long, LoggedEvent>> events =
            new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, EntityCheckpoint> checkpoints = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryHistoryStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendEvent(String agentId, long sequence, AgentEvent event) {
        events.computeIfAbsent(agentId, id -> new ConcurrentSkipListMap<>())
                .put(sequence, new LoggedEvent(agentId, sequence, event, clock.instant()));
    }

    @Override
    public void saveCheckpoint(EntityCheckpoint checkpoint) {
        checkpoints.put(checkpoint.agentId(), checkpoint);
    }

    @Override
    public Optional<EntityCheckpoint> loadLatestCheckpoint(String agentId) {
        return Optional.ofNullable(checkpoints.get(agentId));
    }

    @Override
    public List<LoggedEvent> readEventsAfter(String agentId, long afterSequence) {
        var log = events.get(agentId);
        return log == null ? List.of() : new ArrayList<>(log.tailMap(afterSequence, false).values());
    }

    @Override
    public HistorySegment readSegment(String agentId, long throughSequence) {
        var log = events.get(agentId);
        List<LoggedEvent> segment = log == null
                ? List.of()
                : new ArrayList<>(log.headMap(throughSequence, true).values());
        return HistorySegment.of(agentId, segment);
    }

    @Override
    public int truncateThrough(String agentId, long throughSequence) {
        var log = events.get(agentId);
        if (log == null) {
            return 0;
        }
        var head = log.headMap(throughSequence, true);
        int count = head.size();
        head.clear();
        return count;
    }

    @Override
    public List<String> listAgentIds() {
        var ids = new TreeSet<>(checkpoints.keySet());
        events.forEach((id, log) -> {
            if (!log.isEmpty()) {
                ids.add(id);
            }
        });
        return new ArrayList<>(ids);
    }

    @Override
    public void deleteAgent(String agentId) {
        events.remove(agentId);
        checkpoints.remove(agentId);
    }

    @Override
    public long segmentSize(String agentId) {
        var log = events.get(agentId);
        return log == null ? 0 : log.size();
    }
}
