package com.aether.core.fleet;

import com.aether.core.model.AssignmentResult;

/**
 * Result of a find-and-assign request.
 *
 * @param agentId  the agent the final attempt went to; null when no candidate was found
 * @param result   the final assignment answer; null when no candidate was found
 * @param attempts assignments tried
 */
public record DispatchOutcome(
    String agentId,
    AssignmentResult result,
    int attempts
) {

    public static DispatchOutcome noCandidate(int attempts) {
        return new DispatchOutcome(null, null, attempts);
    }

    public boolean isAssigned() {
        return result != null && result.isAccepted();
    }
}
