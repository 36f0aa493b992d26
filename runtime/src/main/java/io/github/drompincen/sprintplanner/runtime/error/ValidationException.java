package io.github.drompincen.sprintplanner.runtime.error;

import io.github.drompincen.sprintplanner.protocol.api.ErrorKind;

public class ValidationException extends PlannerException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_FAILURE, message, null);
    }

    public ValidationException(String message, String remediation) {
        super(ErrorKind.VALIDATION_FAILURE, message, remediation);
    }
}
