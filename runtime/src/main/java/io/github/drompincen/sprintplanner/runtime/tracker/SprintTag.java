package io.github.drompincen.sprintplanner.runtime.tracker;

import java.time.Instant;

/** A sprint association carried on a tracker issue. */
public record SprintTag(String name, Instant startDate, Instant endDate, String state) {}
