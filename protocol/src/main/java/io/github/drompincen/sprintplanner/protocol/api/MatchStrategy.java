package io.github.drompincen.sprintplanner.protocol.api;

public enum MatchStrategy {
    SPRINT_FIELD,
    DATE_RANGE,
    LATEST_SPRINT_FALLBACK,
    NO_SPRINT_FOUND
}
