package io.github.drompincen.sprintplanner.protocol.api;

public record SprintUpdate(
        String sprintId,
        String sprintName,
        Double previousVelocity,
        double actualVelocity
) {}
