package com.aether.dispatch.cli;

import com.aether.core.model.AgentSnapshot;
import com.aether.core.persistence.EntityCheckpoint;
import com.aether.core.persistence.HistoryQueryService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * CLI command: aether status &lt;agent-id&gt;
 * <p>
 * Shows an agent's last checkpointed state and how many events a restart would
 * replay on top of it. With {@code --live} the current state is fetched from a
 * running server instead.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check agent status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Agent ID")
    private String agentId;

    @Option(names = {"--live", "-l"}, description = "Query a running server instead of the history store")
    private boolean live;

    @Option(names = {"--port"}, description = "Server port for live mode (default: ${DEFAULT-VALUE})",
            defaultValue = "8080")
    private int port;

    private final HistoryQueryService queryService;

    public StatusCommand(HistoryQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        if (live) {
            runLiveMode();
            return;
        }

        ConsoleOutput.printBanner();

        var checkpointOpt = queryService.latestCheckpoint(agentId);
        if (checkpointOpt.isEmpty()) {
            ConsoleOutput.error("Agent not found: " + agentId);
            return;
        }

        EntityCheckpoint checkpoint = checkpointOpt.get();
        AgentSnapshot agent = checkpoint.agent();

        System.out.println();
        System.out.println("AGENT " + agent.agentId());
        ConsoleOutput.lifecycle(agent.lifecycleState());
        System.out.println("  Connected: " + agent.connected() + " | Armed: " + agent.armed()
                + " | GPS fix: " + agent.gpsFix());
        System.out.println("  Battery: " + (agent.battery() != null ? String.format("%.0f%%", agent.battery()) : "-")
                + " | Position: " + (agent.position() != null ? agent.position() : "-"));
        if (!agent.attributes().sensors().isEmpty()) {
            System.out.println("  Sensors: " + String.join(", ", agent.attributes().sensors()));
        }
        if (agent.fault() != null) {
            ConsoleOutput.error("Fault: " + agent.fault());
        }
        if (checkpoint.activeMission() != null) {
            ConsoleOutput.mission("Mission", checkpoint.activeMission());
        }
        if (checkpoint.suspendedMission() != null) {
            ConsoleOutput.mission("Suspended", checkpoint.suspendedMission());
        }
        if (!checkpoint.drafts().isEmpty()) {
            System.out.println("  Drafts: " + String.join(", ", checkpoint.drafts().keySet()));
        }

        int pending = queryService.pendingEvents(agentId).size();
        System.out.println();
        ConsoleOutput.info("Checkpoint #" + checkpoint.sequence() + " taken " + checkpoint.takenAt()
                + "; " + pending + " event" + (pending != 1 ? "s" : "") + " recorded since.");
    }

    private void runLiveMode() {
        ConsoleOutput.printBanner();
        URI uri = URI.create("http://localhost:" + port + "/api/v1/agents/" + agentId);

        try {
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .build();

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept", "application/json")
                    .GET()
                    .build();

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() == 404) {
                ConsoleOutput.error("Agent not found: " + agentId);
                return;
            }
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return;
            }
            System.out.println(response.body());

        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Aether server at localhost:" + port);
            ConsoleOutput.info("Start the server first: aether serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Live query failed: " + e.getMessage());
        }
    }
}
