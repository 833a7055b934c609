package com.aether.dispatch.cli;

import com.aether.core.persistence.HistoryQueryService;
import com.aether.core.persistence.LoggedEvent;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.time.Instant;
import java.util.List;

/**
 * CLI command: aether timeline &lt;agent-id&gt;
 * <p>
 * Chronological list of the events recorded for an agent, from retired history
 * segments still held in the archive followed by the live log.
 */
@Command(name = "timeline", mixinStandardHelpOptions = true, description = "Show an agent's event timeline")
@Component
public class TimelineCommand implements Runnable {

    @Parameters(index = "0", description = "Agent ID")
    private String agentId;

    private final HistoryQueryService queryService;

    public TimelineCommand(HistoryQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<LoggedEvent> events = queryService.timeline(agentId);
        if (events.isEmpty()) {
            ConsoleOutput.error("No events recorded for agent: " + agentId);
            return;
        }

        ConsoleOutput.info("Timeline for agent " + agentId);
        System.out.println();
        System.out.printf("  %-8s %-26s %-26s %s%n", "SEQ", "EVENT", "AT", "RECORDED");
        System.out.println("  " + "-".repeat(84));

        for (LoggedEvent logged : events) {
            System.out.printf("  %-8d %-26s %-26s %s%n",
                    logged.sequence(),
                    ConsoleOutput.truncate(logged.event().eventName(), 26),
                    Instant.ofEpochMilli(logged.event().timestamp()),
                    logged.recordedAt());
        }

        System.out.println();
        ConsoleOutput.info(events.size() + " event" + (events.size() != 1 ? "s" : "") + " recorded.");
    }
}
