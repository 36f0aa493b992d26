package io.github.drompincen.sprintplanner.runtime.error;

import io.github.drompincen.sprintplanner.protocol.api.ErrorKind;

import java.time.Duration;

public class SyncTimeoutException extends PlannerException {

    public SyncTimeoutException(String operation, Duration budget) {
        super(ErrorKind.TIMEOUT,
                operation + " did not finish within " + budget.toSeconds() + "s",
                "Request a smaller page of epics or retry when the tracker is less busy");
    }
}
