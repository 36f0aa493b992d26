package io.github.drompincen.sprintplanner.protocol.api;

import java.util.List;

public record SprintBatchResult(
        List<SprintDto> sprints,
        List<String> skipped,
        String message
) {}
