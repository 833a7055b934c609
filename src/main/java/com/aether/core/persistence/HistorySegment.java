package com.aether.core.persistence;

import java.util.List;

/**
 * A contiguous run of an agent's logged events. Segments superseded by a checkpoint
 * are handed to the archive before they are truncated.
 */
public record HistorySegment(
    String agentId,
    long fromSequence,
    long toSequence,
    List<LoggedEvent> events
) {

    public HistorySegment {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static HistorySegment of(String agentId, List<LoggedEvent> events) {
        if (events.isEmpty()) {
            return new HistorySegment(agentId, 0, 0, List.of());
        }
        return new HistorySegment(agentId, events.get(0).sequence(),
                events.get(events.size() - 1).sequence(), events);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
