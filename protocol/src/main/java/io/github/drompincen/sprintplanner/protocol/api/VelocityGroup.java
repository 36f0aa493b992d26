package io.github.drompincen.sprintplanner.protocol.api;

import java.util.List;

public record VelocityGroup(
        String name,
        GroupSource source,
        int ticketCount,
        double totalStoryPoints,
        List<String> ticketKeys
) {
    public enum GroupSource {
        FIX_VERSION, SPRINT_TAG, UNASSIGNED
    }
}
