package io.github.drompincen.sprintplanner.protocol.api;

import java.time.Instant;
import java.util.List;

public record CreateWorkItemRequest(
        String title,
        String description,
        Double storyPoints,
        Instant requiredCompletionDate,
        List<String> requiredSkills,
        List<String> dependencies,
        WorkItemStatus status,
        String externalId,
        String externalStatus,
        String epicId,
        Boolean epic,
        String priority
) {}
