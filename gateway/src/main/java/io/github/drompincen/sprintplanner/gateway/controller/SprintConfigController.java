package io.github.drompincen.sprintplanner.gateway.controller;

import io.github.drompincen.sprintplanner.protocol.api.SprintConfigDto;
import io.github.drompincen.sprintplanner.runtime.sprint.SprintConfigService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/sprint-config")
public class SprintConfigController {

    private final SprintConfigService sprintConfigService;

    public SprintConfigController(SprintConfigService sprintConfigService) {
        this.sprintConfigService = sprintConfigService;
    }

    @GetMapping
    public SprintConfigDto get() {
        return sprintConfigService.getCurrent();
    }

    @PostMapping
    public SprintConfigDto save(@RequestBody SprintConfigDto config) {
        return sprintConfigService.save(config);
    }
}
