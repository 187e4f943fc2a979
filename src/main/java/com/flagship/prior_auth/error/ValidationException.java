package com.flagship.prior_auth.error;

import java.util.List;

/**
 * Malformed input, detected before any side effect.
 */
public class ValidationException extends PriorAuthException {

    private final List<String> violations;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<String> violations) {
        super(violations.isEmpty() ? message : message + ": " + String.join("; ", violations),
                RetryGuidance.DO_NOT_RETRY);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
