package com.aether.core.planner;

/**
 * Channel back to the external planner that authors mission plans.
 */
public interface PlannerGateway {

    /**
     * Return an operator's reasons for rejecting a proposed plan so the planner can revise it.
     */
    void submitFeedback(String agentId, String draftId, String feedback);
}
