package com.golden.controlplane.exception;

import java.util.List;

/**
 * Malformed input. The caller's fault; never retried by the control plane.
 */
public class ValidationException extends ControlPlaneException {
    private final List<String> violations;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<String> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
