package com.aether.core.events;

import com.aether.core.model.MissionPlan;

/**
 * Signals issued by operators, the dispatcher or the planner collaborator.
 */
public interface OperatorSignal extends AgentEvent {

    /**
     * Assign a plan. {@code missionId} is chosen by the caller so a replay
     * recreates the same mission.
     */
    record AssignMission(String agentId, long timestamp, String missionId, MissionPlan plan)
            implements OperatorSignal {}

    record ProposePlan(String agentId, long timestamp, String draftId, MissionPlan plan)
            implements OperatorSignal {}

    record ApprovePlan(String agentId, long timestamp, String draftId, String missionId)
            implements OperatorSignal {}

    record RejectPlan(String agentId, long timestamp, String draftId, String feedback)
            implements OperatorSignal {}

    /** Jumps the mailbox queue and aborts any executing mission. */
    record EmergencyStop(String agentId, long timestamp) implements OperatorSignal {
        @Override
        public EventPriority priority() {
            return EventPriority.EMERGENCY;
        }
    }

    /** The only way out of ERROR. */
    record ClearError(String agentId, long timestamp) implements OperatorSignal {}
}
