package com.aether.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * Synchronous answer to an assignment signal.
 *
 * @param missionId set only when {@code outcome} is ACCEPTED
 * @param reason    set only when {@code outcome} is CONSTRAINT_VIOLATION
 */
public record AssignmentResult(
    Outcome outcome,
    String missionId,
    String reason
) implements Serializable {

    public enum Outcome { ACCEPTED, BUSY, UNREACHABLE, CONSTRAINT_VIOLATION }

    public static AssignmentResult accepted(String missionId) {
        return new AssignmentResult(Outcome.ACCEPTED, missionId, null);
    }

    public static AssignmentResult busy() {
        return new AssignmentResult(Outcome.BUSY, null, null);
    }

    public static AssignmentResult unreachable() {
        return new AssignmentResult(Outcome.UNREACHABLE, null, null);
    }

    public static AssignmentResult violation(String reason) {
        return new AssignmentResult(Outcome.CONSTRAINT_VIOLATION, null, reason);
    }

    @JsonIgnore
    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }
}
