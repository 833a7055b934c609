package com.aether.core.model;

/**
 * Phases of a single mission instance. COMPLETED and ABORTED are terminal.
 */
public enum MissionPhase {
    DRAFT,
    VALIDATING,
    EXECUTING,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
