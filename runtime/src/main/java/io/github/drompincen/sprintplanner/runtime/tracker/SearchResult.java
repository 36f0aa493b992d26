package io.github.drompincen.sprintplanner.runtime.tracker;

import java.util.List;

/** One page of issues plus the full match count for the query. */
public record SearchResult(List<TrackerIssue> issues, int total) {}
