package io.github.drompincen.sprintplanner.runtime.tracker;

public record PageWindow(int startAt, int limit) {

    public PageWindow {
        if (startAt < 0) throw new IllegalArgumentException("startAt must be >= 0");
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    }

    /** First page capped at {@code cap} results. */
    public static PageWindow cap(int cap) {
        return new PageWindow(0, cap);
    }
}
