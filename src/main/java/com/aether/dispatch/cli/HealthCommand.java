package com.aether.dispatch.cli;

import com.aether.core.health.HealthCheckService;
import com.aether.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: aether health
 * <p>
 * Runs all health checks and displays results with colored output.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Runnable {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.info(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }

        System.out.println("──────────────────────────────────");
        switch (HealthStatus.overall(checks)) {
            case DOWN -> ConsoleOutput.error("Overall: one or more components down");
            case DEGRADED -> ConsoleOutput.info("Overall: operational with degraded components");
            case UP -> ConsoleOutput.success("Overall: operational");
        }
    }
}
