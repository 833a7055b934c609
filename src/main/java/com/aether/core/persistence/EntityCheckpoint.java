package com.aether.core.persistence;

import com.aether.core.detection.DetectionWindow;
import com.aether.core.model.AgentSnapshot;
import com.aether.core.model.MissionExecution;
import com.aether.core.model.MissionPlan;
import com.aether.core.model.PendingCommand;

import java.time.Instant;
import java.util.Map;

/**
 * Full durable state of one entity actor, taken between two processed events.
 * <p>
 * {@code sequence} is the last event folded into this state; rehydration replays only
 * the events recorded after it.
 *
 * @param graceDeadline      when a suspended mission times out, null if none is suspended
 * @param recoveryCommand    outstanding recovery directive from an aborted mission
 */
public record EntityCheckpoint(
    String agentId,
    long sequence,
    Instant takenAt,
    AgentSnapshot agent,
    MissionExecution activeMission,
    MissionExecution suspendedMission,
    Long graceDeadline,
    DetectionWindow detection,
    Map<String, MissionPlan> drafts,
    PendingCommand recoveryCommand
) {

    public EntityCheckpoint {
        drafts = drafts == null ? Map.of() : Map.copyOf(drafts);
    }
}
