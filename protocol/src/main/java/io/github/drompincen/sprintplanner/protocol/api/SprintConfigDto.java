package io.github.drompincen.sprintplanner.protocol.api;

import java.time.Instant;

public record SprintConfigDto(
        String configId,
        Instant firstSprintStartDate,
        int sprintDurationDays,
        double defaultVelocity,
        Instant createdAt,
        Instant updatedAt
) {}
