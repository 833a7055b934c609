package com.aether;

import com.aether.dispatch.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class AetherApplication {

    public static void main(String[] args) {
        boolean serveMode = CliRunner.isServeMode(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(AetherApplication.class);

        if (serveMode) {
            // REST API plus the agent actors
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            );
        } else {
            // CLI-only: read the history store, never start actors that would
            // compete with a running server for the same agents
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off",
                    "aether.runtime.enabled=false"
            );
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }
}
