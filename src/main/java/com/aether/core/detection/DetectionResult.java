package com.aether.core.detection;

/**
 * Decision plus the window the caller should keep for the next evaluation.
 */
public record DetectionResult(
    DetectionDecision decision,
    DetectionWindow window
) {

    static DetectionResult keep(DetectionWindow window) {
        return new DetectionResult(DetectionDecision.CONTINUE, window);
    }
}
