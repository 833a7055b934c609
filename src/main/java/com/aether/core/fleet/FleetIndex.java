package com.aether.core.fleet;

import com.aether.core.model.AgentSnapshot;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Read-mostly index of the latest committed snapshot of every agent.
 * <p>
 * Each agent's actor is the only writer of its entry. Writers swap in a fresh immutable
 * map, so a reader holding {@link #snapshot()} sees a consistent fleet and never a
 * partially written record.
 */
@Component
public class FleetIndex {

    private final AtomicReference<Map<String, AgentSnapshot>> entries = new AtomicReference<>(Map.of());

    /**
     * Publish a committed snapshot. Ignored if the index already holds a later one.
     */
    public void publish(AgentSnapshot snapshot) {
        entries.updateAndGet(current -> {
            AgentSnapshot existing = current.get(snapshot.agentId());
            if (existing != null && existing.sequence() > snapshot.sequence()) {
                return current;
            }
            Map<String, AgentSnapshot> next = new HashMap<>(current);
            next.put(snapshot.agentId(), snapshot);
            return Map.copyOf(next);
        });
    }

    public void remove(String agentId) {
        entries.updateAndGet(current -> {
            if (!current.containsKey(agentId)) {
                return current;
            }
            Map<String, AgentSnapshot> next = new HashMap<>(current);
            next.remove(agentId);
            return Map.copyOf(next);
        });
    }

    /** Point-in-time view of the whole fleet. */
    public Map<String, AgentSnapshot> snapshot() {
        return entries.get();
    }

    public Optional<AgentSnapshot> get(String agentId) {
        return Optional.ofNullable(entries.get().get(agentId));
    }

    public int size() {
        return entries.get().size();
    }
}
