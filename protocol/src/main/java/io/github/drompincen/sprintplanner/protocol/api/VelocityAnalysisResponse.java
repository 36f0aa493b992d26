package io.github.drompincen.sprintplanner.protocol.api;

import java.util.List;

public record VelocityAnalysisResponse(
        String projectKey,
        int totalTickets,
        double totalStoryPoints,
        List<VelocityGroup> groups,
        List<SyncResult> syncResults
) {}
