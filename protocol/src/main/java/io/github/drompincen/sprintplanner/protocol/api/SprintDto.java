package io.github.drompincen.sprintplanner.protocol.api;

import java.time.Instant;
import java.util.List;

public record SprintDto(
        String sprintId,
        String name,
        Instant startDate,
        Instant endDate,
        double plannedVelocity,
        Double actualVelocity,
        boolean archived,
        List<String> workItemIds,
        Instant createdAt,
        Instant updatedAt
) {}
