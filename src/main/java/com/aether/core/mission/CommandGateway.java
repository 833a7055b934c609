package com.aether.core.mission;

import java.util.concurrent.CompletableFuture;

/**
 * Transport to the physical vehicles.
 * <p>
 * Commands are idempotent requests. The returned future completes when the vehicle
 * acknowledges the command and completes exceptionally when it rejects it; a future
 * that never completes is caught by the sender's acknowledgement deadline.
 */
public interface CommandGateway {

    CompletableFuture<Void> send(AgentCommand command);
}
