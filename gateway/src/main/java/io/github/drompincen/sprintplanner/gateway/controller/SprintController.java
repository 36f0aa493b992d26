package io.github.drompincen.sprintplanner.gateway.controller;

import io.github.drompincen.sprintplanner.protocol.api.SprintBatchRequest;
import io.github.drompincen.sprintplanner.protocol.api.SprintBatchResult;
import io.github.drompincen.sprintplanner.protocol.api.SprintDefinition;
import io.github.drompincen.sprintplanner.protocol.api.SprintDto;
import io.github.drompincen.sprintplanner.runtime.sprint.SprintBatchService;
import io.github.drompincen.sprintplanner.runtime.sprint.SprintService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sprints")
public class SprintController {

    private final SprintService sprintService;
    private final SprintBatchService sprintBatchService;

    public SprintController(SprintService sprintService, SprintBatchService sprintBatchService) {
        this.sprintService = sprintService;
        this.sprintBatchService = sprintBatchService;
    }

    @GetMapping
    public List<SprintDto> list() {
        return sprintService.toDtos(sprintService.findActive());
    }

    @PostMapping
    public ResponseEntity<SprintDto> create(@RequestBody SprintDefinition definition) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(sprintService.toDto(sprintService.create(definition)));
    }

    @PutMapping("/{sprintId}")
    public SprintDto update(@PathVariable String sprintId, @RequestBody SprintDefinition changes) {
        return sprintService.toDto(sprintService.update(sprintId, changes));
    }

    /** Archives; sprints are never hard-deleted through the API. */
    @DeleteMapping("/{sprintId}")
    public SprintDto archive(@PathVariable String sprintId) {
        return sprintService.toDto(sprintService.archive(sprintId));
    }

    @PostMapping("/batch")
    public SprintBatchResult batch(@RequestBody SprintBatchRequest request) {
        return sprintBatchService.applyBatch(request.sprints(), request.regeneration());
    }
}
