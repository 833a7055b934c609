package com.aether.core.model;

/**
 * Why a mission ended in {@link MissionPhase#ABORTED}.
 */
public enum AbortReason {
    VALIDATION_FAILURE,
    CONSTRAINT_BREACH,
    COMMAND_TIMEOUT,
    CONNECTIVITY_TIMEOUT,
    EMERGENCY_STOP,
    UNEXPECTED_DISARM,
    AGENT_FAULT,
    DECOMMISSIONED
}
