package com.aether.core.fleet;

import com.aether.core.config.AetherProperties;
import com.aether.core.entity.FleetRegistry;
import com.aether.core.model.AssignmentResult;
import com.aether.core.model.DispatchMatch;
import com.aether.core.model.DispatchQuery;
import com.aether.core.model.MissionPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Finds the best agent for a plan and assigns it.
 * <p>
 * The index may lag the actors, so the chosen agent can turn out to be busy or offline
 * by the time the signal arrives. Those answers exclude the agent and try the next
 * candidate, up to the configured number of attempts. A constraint violation is final.
 */
@Service
public class MissionDispatchService {

    private static final Logger log = LoggerFactory.getLogger(MissionDispatchService.class);

    private final FleetDispatcher dispatcher;
    private final FleetRegistry registry;
    private final int maxAttempts;

    public MissionDispatchService(FleetDispatcher dispatcher, FleetRegistry registry, AetherProperties properties) {
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.maxAttempts = Math.max(1, properties.getDispatch().getMaxAttempts());
    }

    public DispatchOutcome dispatch(DispatchQuery query, MissionPlan plan) {
        DispatchQuery current = query;
        DispatchOutcome last = DispatchOutcome.noCandidate(0);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<DispatchMatch> match = dispatcher.find(current);
            if (match.isEmpty()) {
                return last.result() == null ? DispatchOutcome.noCandidate(attempt - 1) : last;
            }
            String agentId = match.get().agentId();
            AssignmentResult result = registry.assign(agentId, plan);
            last = new DispatchOutcome(agentId, result, attempt);
            if (result.outcome() != AssignmentResult.Outcome.BUSY
                    && result.outcome() != AssignmentResult.Outcome.UNREACHABLE) {
                return last;
            }
            log.info("Agent {} answered {} to dispatch; trying next candidate", agentId, result.outcome());
            current = current.excluding(agentId);
        }
        return last;
    }
}
