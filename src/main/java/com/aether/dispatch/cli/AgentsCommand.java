package com.aether.dispatch.cli;

import com.aether.core.persistence.HistoryQueryService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: aether agents
 * <p>
 * Lists every agent with stored history as a table:
 * Agent ID | State | Mission | Checkpoint | Pending events.
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "List enrolled agents")
@Component
public class AgentsCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "20")
    private int limit;

    private final HistoryQueryService queryService;

    public AgentsCommand(HistoryQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<String> agentIds = queryService.listAgentIds();
        if (agentIds.isEmpty()) {
            ConsoleOutput.info("No agents found.");
            return;
        }

        List<String> display = agentIds.size() > limit ? agentIds.subList(0, limit) : agentIds;

        ConsoleOutput.info("Agents (" + display.size() + " of " + agentIds.size() + "):");
        System.out.println();
        System.out.printf("  %-16s %-12s %-22s %-10s %s%n", "AGENT ID", "STATE", "MISSION", "CHECKPOINT", "PENDING");
        System.out.println("  " + "-".repeat(72));

        for (String agentId : display) {
            var checkpointOpt = queryService.latestCheckpoint(agentId);
            if (checkpointOpt.isPresent()) {
                var cp = checkpointOpt.get();
                String mission = cp.activeMission() != null
                        ? cp.activeMission().missionId() + " " + cp.activeMission().phase()
                        : "-";
                System.out.printf("  %-16s %-12s %-22s %-10d %d%n",
                        ConsoleOutput.truncate(agentId, 16), cp.agent().lifecycleState(),
                        ConsoleOutput.truncate(mission, 22), cp.sequence(),
                        queryService.pendingEvents(agentId).size());
            } else {
                System.out.printf("  %-16s %-12s %-22s %-10s %s%n", agentId, "UNKNOWN", "-", "-", "-");
            }
        }
    }
}
