package com.aether.core.persistence;

import com.aether.core.events.AgentEvent;

import java.util.List;
import java.util.Optional;

/**
 * Durable per-agent history: a write-ahead event log plus the latest checkpoint.
 * <p>
 * Implementations must make {@link #appendEvent} durable before returning, and must
 * keep every event with a sequence above the latest checkpoint's.
 */
public interface HistoryStore {

    void appendEvent(String agentId, long sequence, AgentEvent event);

    /** Replace the agent's checkpoint. Only the latest is kept. */
    void saveCheckpoint(EntityCheckpoint checkpoint);

    Optional<EntityCheckpoint> loadLatestCheckpoint(String agentId);

    /** Events with a sequence strictly greater than {@code afterSequence}, in order. */
    List<LoggedEvent> readEventsAfter(String agentId, long afterSequence);

    /** Events with a sequence up to and including {@code throughSequence}, in order. */
    HistorySegment readSegment(String agentId, long throughSequence);

    /** Drop events up to and including {@code throughSequence}; returns how many went. */
    int truncateThrough(String agentId, long throughSequence);

    /** Agents that have a checkpoint or any logged event. */
    List<String> listAgentIds();

    void deleteAgent(String agentId);

    /** Number of events currently held for the agent. */
    long segmentSize(String agentId);
}
