package io.github.drompincen.sprintplanner.runtime.error;

import io.github.drompincen.sprintplanner.protocol.api.ErrorKind;

public class NotFoundException extends PlannerException {

    public NotFoundException(String what, String id) {
        super(ErrorKind.NOT_FOUND, what + " not found: " + id, null);
    }
}
