package com.aether.dispatch.api;

import com.aether.core.health.HealthCheckService;
import com.aether.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for system health status.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health — System health check.
     * Returns 200 when nothing is DOWN (DEGRADED components still answer 200), 503 otherwise.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();

        if (healthCheckService == null) {
            result.put("status", "DOWN");
            result.put("components", Map.of());
            return ResponseEntity.status(503).body(result);
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : checks) {
            Map<String, Object> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                componentInfo.put("metadata", check.metadata());
            }
            components.put(check.component(), componentInfo);
        }

        HealthStatus.Status overall = HealthStatus.overall(checks);
        result.put("status", overall.name());
        result.put("components", components);

        return overall == HealthStatus.Status.DOWN ? ResponseEntity.status(503).body(result)
                                                   : ResponseEntity.ok(result);
    }
}
