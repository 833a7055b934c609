package com.aether.core.persistence;

import com.aether.core.events.AgentEvent;

import java.time.Instant;

/**
 * One event as recorded in an agent's history, in processing order.
 */
public record LoggedEvent(
    String agentId,
    long sequence,
    AgentEvent event,
    Instant recordedAt
) {}
