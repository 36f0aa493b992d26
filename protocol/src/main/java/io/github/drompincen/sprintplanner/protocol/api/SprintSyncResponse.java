package io.github.drompincen.sprintplanner.protocol.api;

import java.util.List;

public record SprintSyncResponse(
        String projectKey,
        List<SyncResult> syncResults,
        List<SprintUpdate> sprintUpdates
) {}
