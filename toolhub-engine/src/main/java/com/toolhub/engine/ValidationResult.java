package com.toolhub.engine;

import java.util.List;

/**
 * Outcome of checking call arguments against a tool's parameter schema. Holds every violation
 * found, in schema order, so a caller can fix all of them at once.
 */
public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(List.of());

    private final List<String> violations;

    private ValidationResult(List<String> violations) {
        this.violations = List.copyOf(violations);
    }

    public static ValidationResult valid() {
        return VALID;
    }

    /** Valid when {@code violations} is null or empty. */
    public static ValidationResult of(List<String> violations) {
        return violations == null || violations.isEmpty() ? VALID : new ValidationResult(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public List<String> getErrors() {
        return violations;
    }

    @Override
    public String toString() {
        return isValid() ? "valid" : String.join("; ", violations);
    }
}
