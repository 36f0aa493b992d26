package io.github.drompincen.sprintplanner.protocol.api;

public record SyncResult(
        String ticketKey,
        String matchedSprintId,
        String matchedSprintName,
        MatchStrategy matchStrategy,
        double storyPoints,
        WorkItemAction workItemAction
) {}
