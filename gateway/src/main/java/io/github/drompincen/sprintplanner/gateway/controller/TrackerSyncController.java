package io.github.drompincen.sprintplanner.gateway.controller;

import io.github.drompincen.sprintplanner.protocol.api.EpicAggregate;
import io.github.drompincen.sprintplanner.protocol.api.EpicImportRequest;
import io.github.drompincen.sprintplanner.protocol.api.PaginatedEpicsResponse;
import io.github.drompincen.sprintplanner.protocol.api.SprintSyncRequest;
import io.github.drompincen.sprintplanner.protocol.api.SprintSyncResponse;
import io.github.drompincen.sprintplanner.protocol.api.VelocityAnalysisResponse;
import io.github.drompincen.sprintplanner.runtime.sync.SprintSyncService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/tracker")
public class TrackerSyncController {

    private final SprintSyncService sprintSyncService;

    public TrackerSyncController(SprintSyncService sprintSyncService) {
        this.sprintSyncService = sprintSyncService;
    }

    @PostMapping("/epics")
    public PaginatedEpicsResponse importEpics(@RequestBody EpicImportRequest request) {
        return sprintSyncService.importEpicsWithChildren(request.projectKey(),
                request.limitOrDefault(), request.startAtOrDefault());
    }

    @GetMapping("/epics/{epicKey}")
    public EpicAggregate importEpic(@PathVariable String epicKey) {
        return sprintSyncService.importSingleEpicWithChildren(epicKey);
    }

    @PostMapping("/sync-past-sprints")
    public SprintSyncResponse syncPastSprints(@RequestBody SprintSyncRequest request) {
        return sprintSyncService.syncCompletedTicketsToPastSprints(request.projectKey(), request.dateRange());
    }

    @GetMapping("/velocity/{projectKey}")
    public VelocityAnalysisResponse velocity(@PathVariable String projectKey) {
        return sprintSyncService.analyzeVelocity(projectKey);
    }
}
