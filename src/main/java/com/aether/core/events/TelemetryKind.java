package com.aether.core.events;

public enum TelemetryKind {
    HEARTBEAT,
    POSITION,
    HOME_POSITION,
    FAULT
}
