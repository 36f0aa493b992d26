package io.github.drompincen.sprintplanner.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SprintBatchRequest(
        List<SprintDefinition> sprints,
        @JsonProperty("isRegeneration") boolean regeneration
) {}
