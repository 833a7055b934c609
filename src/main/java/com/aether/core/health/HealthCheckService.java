package com.aether.core.health;

import com.aether.core.config.AetherProperties;
import com.aether.core.entity.FleetRegistry;
import com.aether.core.persistence.HistoryCompactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final FleetRegistry registry;
    private final HistoryCompactor compactor;
    private final AetherProperties properties;
    private final DataSource dataSource;

    public HealthCheckService(
            FleetRegistry registry,
            HistoryCompactor compactor,
            AetherProperties properties,
            @Autowired(required = false) DataSource dataSource) {
        this.registry = registry;
        this.compactor = compactor;
        this.properties = properties;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkRuntime());
        results.add(checkHistoryStore());
        results.add(checkCompaction());
        return results;
    }

    /**
     * Worst status across all components.
     */
    public HealthStatus.Status overall() {
        return HealthStatus.overall(checkAll());
    }

    private HealthStatus checkRuntime() {
        if (!properties.getRuntime().isEnabled()) {
            return HealthStatus.degraded("runtime",
                    "Agent runtime disabled in this process", Map.of());
        }
        return HealthStatus.up("runtime",
                "Agent actors running", Map.of("agents", String.valueOf(registry.list().size())));
    }

    private HealthStatus checkHistoryStore() {
        String store = properties.getHistory().getStore();
        if ("memory".equals(store)) {
            return HealthStatus.degraded("history",
                    "In-memory history store; state will not survive a restart", Map.of("store", store));
        }
        if (dataSource == null) {
            return HealthStatus.down("history",
                    "No DataSource configured", Map.of("store", store));
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("history",
                        "Database connection valid", Map.of("store", store));
            }
            return HealthStatus.down("history",
                    "Database connection invalid", Map.of("store", store));
        } catch (Exception e) {
            log.warn("History store health check failed: {}", e.getMessage());
            return HealthStatus.down("history",
                    "Database error: " + e.getMessage(), Map.of("store", store));
        }
    }

    private HealthStatus checkCompaction() {
        List<String> degraded = compactor.degradedAgents();
        if (degraded.isEmpty()) {
            return HealthStatus.up("compaction",
                    "Checkpoints persisting", Map.of());
        }
        return HealthStatus.degraded("compaction",
                "Repeated compaction failures for " + degraded.size() + " agent(s)",
                Map.of("agents", String.join(",", degraded)));
    }
}
