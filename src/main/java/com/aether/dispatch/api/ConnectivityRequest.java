package com.aether.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/agents/{id}/connectivity.
 *
 * @param timestamp nullable, defaults to receipt time
 */
public record ConnectivityRequest(
    boolean connected,
    Long timestamp
) {}
