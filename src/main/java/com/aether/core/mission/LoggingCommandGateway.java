package com.aether.core.mission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Stand-in transport used when no vehicle link is configured: logs each command and
 * acknowledges it at once. Declare a {@code @Primary} gateway to replace it.
 */
@Component
public class LoggingCommandGateway implements CommandGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingCommandGateway.class);

    @Override
    public CompletableFuture<Void> send(AgentCommand command) {
        log.info("Command {} {} -> agent {} (attempt {}, params={})",
                command.commandId(), command.type(), command.agentId(), command.attempt(), command.params());
        return CompletableFuture.completedFuture(null);
    }
}
