package io.github.drompincen.sprintplanner.protocol.api;

import java.time.Instant;

/** Inclusive window; either bound may be null for an open end. */
public record DateRange(Instant from, Instant to) {

    public static DateRange unbounded() {
        return new DateRange(null, null);
    }

    public boolean contains(Instant instant) {
        if (instant == null) return false;
        if (from != null && instant.isBefore(from)) return false;
        return to == null || !instant.isAfter(to);
    }
}
