package com.aether.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: aether serve
 * <p>
 * Starts the agent actors and the REST API. The web server is enabled by
 * {@link com.aether.AetherApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli in that mode. The banner is printed once the
 * web server is listening.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 aether serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Aether fleet server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Aether server running on port " + port);
        System.out.println();
        System.out.println("  Agents:    http://localhost:" + port + "/api/v1/agents");
        System.out.println("  Dispatch:  http://localhost:" + port + "/api/v1/dispatch");
        System.out.println("  Health:    http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
