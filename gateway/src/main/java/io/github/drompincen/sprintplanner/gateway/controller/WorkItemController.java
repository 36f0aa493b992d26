package io.github.drompincen.sprintplanner.gateway.controller;

import io.github.drompincen.sprintplanner.protocol.api.AssignSprintRequest;
import io.github.drompincen.sprintplanner.protocol.api.CreateWorkItemRequest;
import io.github.drompincen.sprintplanner.protocol.api.WorkItemDto;
import io.github.drompincen.sprintplanner.runtime.workitem.WorkItemService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/work-items")
public class WorkItemController {

    private final WorkItemService workItemService;

    public WorkItemController(WorkItemService workItemService) {
        this.workItemService = workItemService;
    }

    @GetMapping
    public List<WorkItemDto> list() {
        return workItemService.listWithEpics();
    }

    @GetMapping("/{workItemId}")
    public WorkItemDto get(@PathVariable String workItemId) {
        return workItemService.getDto(workItemId);
    }

    @PostMapping
    public ResponseEntity<WorkItemDto> create(@RequestBody CreateWorkItemRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workItemService.create(request));
    }

    @PutMapping("/{workItemId}")
    public WorkItemDto update(@PathVariable String workItemId, @RequestBody CreateWorkItemRequest request) {
        return workItemService.update(workItemId, request);
    }

    @DeleteMapping("/{workItemId}")
    public ResponseEntity<Void> delete(@PathVariable String workItemId) {
        workItemService.delete(workItemId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{workItemId}/assign-sprint")
    public WorkItemDto assign(@PathVariable String workItemId, @RequestBody AssignSprintRequest request) {
        return workItemService.assign(workItemId, request.sprintId());
    }

    @DeleteMapping("/{workItemId}/assign-sprint/{sprintId}")
    public WorkItemDto unassign(@PathVariable String workItemId, @PathVariable String sprintId) {
        return workItemService.unassign(workItemId, sprintId);
    }
}
