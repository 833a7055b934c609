package com.aether.core.model;

/**
 * Lifecycle of a tracked agent as owned by its entity actor.
 */
public enum AgentLifecycleState {
    OFFLINE,
    ONLINE_IDLE,
    ONLINE_ARMED,    // Candidate session, not yet confirmed
    IN_MISSION,
    ERROR
}
