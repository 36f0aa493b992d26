package io.github.drompincen.sprintplanner.protocol.api;

import java.util.List;

public record PaginatedEpicsResponse(List<EpicAggregate> epics, Pagination pagination) {}
