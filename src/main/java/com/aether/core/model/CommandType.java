package com.aether.core.model;

/**
 * Outbound directives understood by the transport collaborator.
 */
public enum CommandType {
    UPLOAD_MISSION,
    ARM,
    TAKEOFF,
    START_MISSION,
    RETURN_TO_LAUNCH,
    LAND,
    HOLD;

    public static CommandType forBreach(BreachAction action) {
        return switch (action) {
            case RETURN_TO_LAUNCH -> RETURN_TO_LAUNCH;
            case LAND -> LAND;
            case HOLD -> HOLD;
        };
    }
}
