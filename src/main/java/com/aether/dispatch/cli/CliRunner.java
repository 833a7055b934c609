package com.aether.dispatch.cli;

import com.aether.core.persistence.HistoryStoreException;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Runs the read-only commands against the history store and reports their exit code to
 * Spring Boot. {@code serve} never reaches picocli: the web server owns the process.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    /** Exit code when the history store cannot be read. */
    static final int EXIT_HISTORY_UNAVAILABLE = 3;

    private final AetherCommand aetherCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AetherCommand aetherCommand, IFactory factory) {
        this.aetherCommand = aetherCommand;
        this.factory = factory;
    }

    public static boolean isServeMode(String... args) {
        return Arrays.asList(args).contains("serve");
    }

    static CommandLine commandLine(AetherCommand root, IFactory factory) {
        return new CommandLine(root, factory)
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    if (e instanceof HistoryStoreException) {
                        ConsoleOutput.error("History store unavailable: " + e.getMessage());
                        return EXIT_HISTORY_UNAVAILABLE;
                    }
                    throw e;
                });
    }

    @Override
    public void run(String... args) {
        if (isServeMode(args)) {
            return;
        }
        exitCode = commandLine(aetherCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
