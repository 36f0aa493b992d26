package io.github.drompincen.sprintplanner.protocol.api;

public record SprintSyncRequest(String projectKey, DateRange dateRange) {}
