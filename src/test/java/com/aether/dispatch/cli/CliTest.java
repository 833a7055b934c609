package com.aether.dispatch.cli;

import com.aether.core.events.ConnectivityChange;
import com.aether.core.events.OperatorSignal;
import com.aether.core.health.HealthCheckService;
import com.aether.core.health.HealthStatus;
import com.aether.core.model.AbortReason;
import com.aether.core.model.AgentAttributes;
import com.aether.core.model.AgentLifecycleState;
import com.aether.core.model.AgentSnapshot;
import com.aether.core.model.GeoPoint;
import com.aether.core.model.MissionExecution;
import com.aether.core.model.MissionPhase;
import com.aether.core.model.MissionPlan;
import com.aether.core.model.RouteStep;
import com.aether.core.persistence.EntityCheckpoint;
import com.aether.core.persistence.HistoryQueryService;
import com.aether.core.persistence.HistoryStoreException;
import com.aether.core.persistence.LoggedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the Aether CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static final Instant TAKEN = Instant.parse("2026-03-01T10:00:00Z");
    private static final GeoPoint HOME = new GeoPoint(47.3977, 8.5456, 0.0);

    private HistoryQueryService createMockQueryService() {
        HistoryQueryService mockService = mock(HistoryQueryService.class);
        when(mockService.listAgentIds()).thenReturn(List.of());
        when(mockService.latestCheckpoint(anyString())).thenReturn(Optional.empty());
        when(mockService.pendingEvents(anyString())).thenReturn(List.of());
        when(mockService.timeline(anyString())).thenReturn(List.of());
        return mockService;
    }

    private HistoryQueryService createPopulatedQueryService() {
        HistoryQueryService mockService = createMockQueryService();
        when(mockService.listAgentIds()).thenReturn(List.of("D1", "D2"));

        var plan = new MissionPlan("P-1", null, null,
                List.of(new RouteStep.Takeoff(30.0), new RouteStep.Land()), null);
        var aborted = new MissionExecution("MSN-2026-0000ABCD", "D1", plan, MissionPhase.ABORTED, 1,
                1_000L, 91_000L, null, AbortReason.CONSTRAINT_BREACH, "altitude 130.0 m above ceiling 120.0 m",
                false, false, 90.0, HOME, List.of(), null);
        var d1 = new AgentSnapshot("D1", new AgentAttributes(Set.of("lidar"), null, null, null, null),
                AgentLifecycleState.IN_MISSION, HOME, HOME, 72.0, true, 3, null, true,
                "MSN-2026-0000ABCD", null, null, 91_000L, 12L);
        when(mockService.latestCheckpoint("D1")).thenReturn(Optional.of(
                new EntityCheckpoint("D1", 12, TAKEN, d1, aborted, null, null, null, Map.of("DRF-0001", plan), null)));
        when(mockService.pendingEvents("D1")).thenReturn(List.of(
                new LoggedEvent("D1", 13, new ConnectivityChange("D1", 92_000L, false), TAKEN)));

        when(mockService.timeline("D1")).thenReturn(List.of(
                new LoggedEvent("D1", 1, new ConnectivityChange("D1", 1_000L, true), TAKEN),
                new LoggedEvent("D1", 2, new OperatorSignal.EmergencyStop("D1", 2_000L), TAKEN)));
        return mockService;
    }

    private CommandLine.IFactory createFactory(HistoryQueryService queryService, HealthCheckService health) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(queryService);
                }
                if (cls == AgentsCommand.class) {
                    return (K) new AgentsCommand(queryService);
                }
                if (cls == TimelineCommand.class) {
                    return (K) new TimelineCommand(queryService);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(health);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(createMockQueryService(), null, args);
    }

    private CliResult execute(HistoryQueryService queryService, HealthCheckService health, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = CliRunner.commandLine(new AetherCommand(), createFactory(queryService, health));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("serve", "status", "agents", "timeline", "health", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
            assertTrue(result.output().contains("Fleet runtime for autonomous aerial agents"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Aether 0.1.0"));
        }

        @Test
        @DisplayName("status --help shows the live option")
        void statusHelpOutput() {
            CliResult result = execute("status", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Check agent status"));
            assertTrue(result.output().contains("--live"));
        }

        @Test
        @DisplayName("agents --help shows the limit option")
        void agentsHelpOutput() {
            CliResult result = execute("agents", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--limit"));
        }
    }

    @Nested
    @DisplayName("Command execution")
    class ExecutionTests {

        @Test
        @DisplayName("status prints the checkpointed agent and its mission")
        void statusWithAgent() {
            CliResult result = execute(createPopulatedQueryService(), null, "status", "D1");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("AGENT D1"));
            assertTrue(output.contains("IN_MISSION"));
            assertTrue(output.contains("Sensors: lidar"));
            assertTrue(output.contains("MSN-2026-0000ABCD"));
            assertTrue(output.contains("CONSTRAINT_BREACH"));
            assertTrue(output.contains("Duration: 1m 30s"));
            assertTrue(output.contains("Drafts: DRF-0001"));
            assertTrue(output.contains("Checkpoint #12"));
            assertTrue(output.contains("1 event recorded since."));
        }

        @Test
        @DisplayName("status for an unknown agent reports it")
        void statusUnknownAgent() {
            CliResult result = execute("status", "ghost");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Agent not found: ghost"));
        }

        @Test
        @DisplayName("status without an agent id fails")
        void statusWithoutArgument() {
            assertNotEquals(0, execute("status").exitCode());
        }

        @Test
        @DisplayName("agents lists known and unknown checkpoints")
        void agentsTable() {
            CliResult result = execute(createPopulatedQueryService(), null, "agents");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("Agents (2 of 2)"));
            assertTrue(output.contains("D1"));
            assertTrue(output.contains("UNKNOWN"), "D2 has no checkpoint");
        }

        @Test
        @DisplayName("agents with an empty store")
        void agentsEmpty() {
            CliResult result = execute("agents");
            assertTrue(result.output().contains("No agents found."));
        }

        @Test
        @DisplayName("agents --limit caps the table")
        void agentsLimit() {
            CliResult result = execute(createPopulatedQueryService(), null, "agents", "--limit", "1");
            assertTrue(result.output().contains("Agents (1 of 2)"));
        }

        @Test
        @DisplayName("timeline lists events in order")
        void timeline() {
            CliResult result = execute(createPopulatedQueryService(), null, "timeline", "D1");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.indexOf("ConnectivityChange") < output.indexOf("EmergencyStop"));
            assertTrue(output.contains("2 events recorded."));
        }

        @Test
        @DisplayName("timeline for an agent with no history")
        void timelineEmpty() {
            CliResult result = execute("timeline", "ghost");
            assertTrue(result.output().contains("No events recorded for agent: ghost"));
        }

        @Test
        @DisplayName("health prints each component and the overall verdict")
        void health() {
            HealthCheckService health = mock(HealthCheckService.class);
            when(health.checkAll()).thenReturn(List.of(
                    new HealthStatus("runtime", HealthStatus.Status.UP, "3 agents enrolled", Map.of()),
                    new HealthStatus("history", HealthStatus.Status.DOWN, "Database unreachable", Map.of())));

            CliResult result = execute(createMockQueryService(), health, "health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("runtime: 3 agents enrolled"));
            assertTrue(result.output().contains("history: Database unreachable"));
            assertTrue(result.output().contains("Overall: one or more components down"));
        }

        @Test
        @DisplayName("an unreadable history store exits with a dedicated code")
        void historyUnavailable() {
            HistoryQueryService broken = createMockQueryService();
            when(broken.listAgentIds()).thenThrow(new HistoryStoreException("Failed to list agent ids", null));

            CliResult result = execute(broken, null, "agents");

            assertEquals(CliRunner.EXIT_HISTORY_UNAVAILABLE, result.exitCode());
            assertTrue(result.output().contains("History store unavailable: Failed to list agent ids"));
        }

        @Test
        @DisplayName("serve is detected anywhere in the arguments")
        void serveMode() {
            assertTrue(CliRunner.isServeMode("--debug", "serve"));
            assertFalse(CliRunner.isServeMode("status", "D1"));
        }

        @Test
        @DisplayName("health without a health service")
        void healthUnavailable() {
            CliResult result = execute("health");
            assertTrue(result.output().contains("Health check service not available"));
        }
    }
}
