package com.aether.dispatch.api;

import com.aether.core.model.MissionPlan;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/agents/{id}/drafts.
 *
 * @param draftId nullable; generated when absent
 */
public record DraftRequest(
    @JsonProperty("draft_id") String draftId,
    MissionPlan plan
) {}
