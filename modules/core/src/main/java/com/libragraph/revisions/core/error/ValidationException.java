package com.libragraph.revisions.core.error;

import java.util.List;

/**
 * Request data is structurally malformed. Carries every violation found, not just the first.
 */
public class ValidationException extends RuntimeException {

    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super("Validation failed: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String violation) {
        this(List.of(violation));
    }

    public List<String> violations() {
        return violations;
    }
}
