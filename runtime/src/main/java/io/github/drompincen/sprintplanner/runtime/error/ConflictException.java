package io.github.drompincen.sprintplanner.runtime.error;

import io.github.drompincen.sprintplanner.protocol.api.ErrorKind;

public class ConflictException extends PlannerException {

    public ConflictException(String message, String remediation) {
        super(ErrorKind.CONFLICT, message, remediation);
    }
}
