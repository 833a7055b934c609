package com.aether.core.events;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.io.Serializable;

/**
 * An input to one agent's entity actor.
 * <p>
 * Every event names its target agent and carries the timestamp (epoch millis) the
 * actor uses for all time-based decisions, so replaying logged events reproduces
 * the same state. Events are recorded verbatim in the agent's history segment.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TelemetryUpdate.class, name = "telemetry"),
        @JsonSubTypes.Type(value = ConnectivityChange.class, name = "connectivity"),
        @JsonSubTypes.Type(value = OperatorSignal.AssignMission.class, name = "assign_mission"),
        @JsonSubTypes.Type(value = OperatorSignal.ProposePlan.class, name = "propose_plan"),
        @JsonSubTypes.Type(value = OperatorSignal.ApprovePlan.class, name = "approve_plan"),
        @JsonSubTypes.Type(value = OperatorSignal.RejectPlan.class, name = "reject_plan"),
        @JsonSubTypes.Type(value = OperatorSignal.EmergencyStop.class, name = "emergency_stop"),
        @JsonSubTypes.Type(value = OperatorSignal.ClearError.class, name = "clear_error"),
        @JsonSubTypes.Type(value = CommandAck.class, name = "command_ack"),
        @JsonSubTypes.Type(value = CommandDeadline.class, name = "command_deadline"),
        @JsonSubTypes.Type(value = ConnectivityGraceExpired.class, name = "grace_expired")
})
public interface AgentEvent extends Serializable {

    String agentId();

    long timestamp();

    default EventPriority priority() {
        return EventPriority.NORMAL;
    }

    /** Short name used for metrics tags and log lines. */
    default String eventName() {
        return getClass().getSimpleName();
    }
}
