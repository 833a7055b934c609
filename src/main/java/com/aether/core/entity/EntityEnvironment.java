package com.aether.core.entity;

import com.aether.core.archive.MissionArchive;
import com.aether.core.config.AetherProperties;
import com.aether.core.detection.DetectionRuleEngine;
import com.aether.core.fleet.FleetIndex;
import com.aether.core.metrics.AetherMetrics;
import com.aether.core.mission.CommandGateway;
import com.aether.core.mission.MissionSettings;
import com.aether.core.mission.MissionStatusService;
import com.aether.core.persistence.HistoryCompactor;
import com.aether.core.persistence.HistoryStore;
import com.aether.core.planner.PlannerGateway;
import com.aether.core.safety.SafetyValidator;

import java.time.Clock;

/**
 * Collaborators shared by every entity actor.
 */
public record EntityEnvironment(
    HistoryStore history,
    HistoryCompactor compactor,
    FleetIndex fleetIndex,
    MissionStatusService missionStatus,
    MissionArchive archive,
    CommandGateway commandGateway,
    PlannerGateway planner,
    SafetyValidator validator,
    DetectionRuleEngine detection,
    AetherMetrics metrics,
    ActorScheduler scheduler,
    Clock clock,
    AetherProperties properties
) {

    MissionSettings missionSettings() {
        AetherProperties.Mission mission = properties.getMission();
        return new MissionSettings(mission.getCommandAckTimeoutMs(), mission.getCommandMaxRetries(),
                mission.getWaypointToleranceMeters());
    }

    long connectivityGraceMs() {
        return properties.getMission().getConnectivityGraceSeconds() * 1000;
    }
}
