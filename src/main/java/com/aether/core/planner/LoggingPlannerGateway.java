package com.aether.core.planner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Records planner feedback in the log when no planner integration is configured.
 */
@Component
public class LoggingPlannerGateway implements PlannerGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingPlannerGateway.class);

    @Override
    public void submitFeedback(String agentId, String draftId, String feedback) {
        log.info("Draft {} for agent {} rejected: {}", draftId, agentId, feedback);
    }
}
