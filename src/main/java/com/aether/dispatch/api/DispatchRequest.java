package com.aether.dispatch.api;

import com.aether.core.model.DispatchQuery;
import com.aether.core.model.MissionPlan;

/**
 * Inbound JSON body for POST /api/v1/dispatch: find the best agent for
 * {@code query} and assign it {@code plan}.
 */
public record DispatchRequest(
    DispatchQuery query,
    MissionPlan plan
) {}
