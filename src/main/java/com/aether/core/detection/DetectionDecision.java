package com.aether.core.detection;

public enum DetectionDecision {
    CONTINUE,
    CONFIRM_SESSION_START,
    CONFIRM_SESSION_END,
    REVERT_FALSE_START
}
