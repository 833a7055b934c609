package com.aether.core.safety;

import java.util.List;

/**
 * Outcome of a pre-flight check. {@link #reason()} joins every violation found,
 * so callers see all problems with a plan at once.
 */
public record ValidationResult(List<String> violations) {

    public ValidationResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static ValidationResult ok() {
        return new ValidationResult(List.of());
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public String reason() {
        return String.join("; ", violations);
    }
}
