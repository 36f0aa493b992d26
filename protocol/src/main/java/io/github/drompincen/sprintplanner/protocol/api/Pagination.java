package io.github.drompincen.sprintplanner.protocol.api;

public record Pagination(int limit, int startAt, int total, boolean hasMore) {}
