package io.github.drompincen.sprintplanner.protocol.api;

import java.time.Instant;
import java.util.List;

/**
 * An epic joined with its children as read from the tracker. Derived on every
 * import, never stored.
 */
public record EpicAggregate(
        String key,
        String title,
        String description,
        WorkItemStatus status,
        String externalStatus,
        Instant createdAt,
        Instant updatedAt,
        List<EpicChild> children,
        double totalStoryPoints,
        double completedStoryPoints
) {
    public record EpicChild(
            String key,
            String title,
            String description,
            double storyPoints,
            WorkItemStatus status,
            String externalStatus,
            List<String> requiredSkills
    ) {}
}
