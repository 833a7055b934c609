package com.aether.core.entity;

import com.aether.core.events.AgentEvent;
import com.aether.core.events.EventPriority;

import java.util.concurrent.CompletableFuture;

/**
 * Mailbox entry: either an event to process or a control task to run between events.
 * Ordered by priority, then by arrival.
 */
record Envelope(
    EventPriority priority,
    long arrival,
    AgentEvent event,
    Runnable control,
    CompletableFuture<Object> reply
) implements Comparable<Envelope> {

    static Envelope of(AgentEvent event, long arrival) {
        return new Envelope(event.priority(), arrival, event, null, new CompletableFuture<>());
    }

    static Envelope control(Runnable task, long arrival) {
        return new Envelope(EventPriority.NORMAL, arrival, null, task, new CompletableFuture<>());
    }

    boolean isControl() {
        return control != null;
    }

    @Override
    public int compareTo(Envelope other) {
        int byPriority = Integer.compare(priority.ordinal(), other.priority.ordinal());
        return byPriority != 0 ? byPriority : Long.compare(arrival, other.arrival);
    }
}
