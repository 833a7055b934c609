package com.aether.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * A command sent to the vehicle and not yet acknowledged.
 *
 * @param commandId stable across retries so the transport can de-duplicate
 * @param attempt   1 for the first send, incremented on every retry
 */
public record PendingCommand(
    String commandId,
    CommandType type,
    Map<String, Object> params,
    int attempt
) implements Serializable {

    public PendingCommand {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public PendingCommand nextAttempt() {
        return new PendingCommand(commandId, type, params, attempt + 1);
    }
}
