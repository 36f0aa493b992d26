package io.github.drompincen.sprintplanner.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkItemDto(
        String workItemId,
        String externalId,
        String title,
        String description,
        String priority,
        double storyPoints,
        Instant requiredCompletionDate,
        List<String> requiredSkills,
        WorkItemStatus status,
        String externalStatus,
        String epicId,
        boolean epic,
        List<String> dependencies,
        List<String> assignedSprintIds,
        List<WorkItemDto> children,
        Instant createdAt,
        Instant updatedAt
) {}
