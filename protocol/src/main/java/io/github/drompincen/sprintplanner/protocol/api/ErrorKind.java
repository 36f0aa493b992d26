package io.github.drompincen.sprintplanner.protocol.api;

public enum ErrorKind {
    REMOTE_QUERY_FAILURE,
    VALIDATION_FAILURE,
    CONFLICT,
    TIMEOUT,
    NOT_FOUND,
    INTERNAL
}
