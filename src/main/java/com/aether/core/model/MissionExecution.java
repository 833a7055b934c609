package com.aether.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Runtime record of one mission, as held by its owning mission state machine.
 * <p>
 * Serves both as the status returned to queries and as the mission part of an
 * entity checkpoint, so it carries everything needed to resume execution.
 *
 * @param observed     true for sessions confirmed by the detection engine rather than assigned
 * @param suspended    true while parked on a disconnected agent awaiting reconnection
 * @param commandQueue commands still to be sent once the pending one is acknowledged
 */
public record MissionExecution(
    String missionId,
    String agentId,
    MissionPlan plan,
    MissionPhase phase,
    int currentStepIndex,
    Long startTime,
    Long endTime,
    MissionMetrics metrics,
    AbortReason abortReason,
    String detail,
    boolean observed,
    boolean suspended,
    Double batteryAtStart,
    GeoPoint lastPosition,
    List<CommandType> commandQueue,
    PendingCommand pendingCommand
) implements Serializable {

    public MissionExecution {
        commandQueue = commandQueue == null ? List.of() : List.copyOf(commandQueue);
        metrics = metrics == null ? MissionMetrics.empty() : metrics;
    }

    public int totalSteps() {
        return plan == null ? 0 : plan.route().size();
    }
}
