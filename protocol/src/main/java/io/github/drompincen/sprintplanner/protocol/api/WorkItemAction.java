package io.github.drompincen.sprintplanner.protocol.api;

public enum WorkItemAction {
    CREATED,
    UPDATED,
    UNCHANGED,
    NONE
}
