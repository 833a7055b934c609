package com.aether.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Aether.
 * Routes to subcommands: serve, status, agents, timeline, health.
 */
@Command(
        name = "aether",
        mixinStandardHelpOptions = true,
        version = "Aether 0.1.0",
        description = "Fleet runtime for autonomous aerial agents",
        subcommands = {
                ServeCommand.class,
                StatusCommand.class,
                AgentsCommand.class,
                TimelineCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AetherCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
