package io.github.drompincen.sprintplanner.protocol.api;

public record AssignSprintRequest(String sprintId) {}
