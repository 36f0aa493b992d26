package io.github.drompincen.sprintplanner.runtime.error;

import io.github.drompincen.sprintplanner.protocol.api.ErrorKind;

import java.util.Map;

/**
 * Base of every failure the planning engine reports to its callers. The kind is
 * machine-classifiable; the remediation is an optional hint for the user.
 */
public abstract class PlannerException extends RuntimeException {

    private final ErrorKind kind;
    private final String remediation;

    protected PlannerException(ErrorKind kind, String message, String remediation) {
        super(message);
        this.kind = kind;
        this.remediation = remediation;
    }

    protected PlannerException(ErrorKind kind, String message, String remediation, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.remediation = remediation;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getRemediation() {
        return remediation;
    }

    /** Extra diagnostic fields for the error response, empty by default. */
    public Map<String, Object> getDetails() {
        return Map.of();
    }
}
