package com.aether.core.health;

import java.util.List;
import java.util.Map;

/**
 * Result of one component check. DEGRADED means the fleet keeps running with reduced
 * guarantees (no durable history, compaction falling behind); only DOWN fails readiness.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DOWN, detail, metadata);
    }

    /**
     * Worst status among {@code checks}; UP for an empty list.
     */
    public static Status overall(List<HealthStatus> checks) {
        Status worst = Status.UP;
        for (HealthStatus check : checks) {
            if (check.status().compareTo(worst) > 0) {
                worst = check.status();
            }
        }
        return worst;
    }
}
