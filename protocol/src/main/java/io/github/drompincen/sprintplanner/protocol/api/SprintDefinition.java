package io.github.drompincen.sprintplanner.protocol.api;

import java.time.Instant;

/**
 * One entry of a batch sprint upsert. Every field except {@code actualVelocity}
 * is required; the batch is rejected as a whole when one is missing.
 */
public record SprintDefinition(
        String name,
        Instant startDate,
        Instant endDate,
        Double plannedVelocity,
        Double actualVelocity
) {}
