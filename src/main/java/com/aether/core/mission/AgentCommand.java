package com.aether.core.mission;

import com.aether.core.model.CommandType;

import java.util.Map;

/**
 * Outbound directive handed to the transport collaborator. Re-sends of the same
 * command keep the {@code commandId}; only {@code attempt} changes.
 */
public record AgentCommand(
    String agentId,
    String missionId,
    String commandId,
    CommandType type,
    Map<String, Object> params,
    int attempt
) {

    public AgentCommand {
        params = params == null ? Map.of() : Map.copyOf(params);
    }
}
