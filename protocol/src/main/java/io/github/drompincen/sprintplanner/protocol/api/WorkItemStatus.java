package io.github.drompincen.sprintplanner.protocol.api;

public enum WorkItemStatus {
    NOT_STARTED("Not Started"),
    IN_PROGRESS("In Progress"),
    COMPLETED("Completed");

    private final String label;

    WorkItemStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
