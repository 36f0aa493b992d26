package io.github.drompincen.sprintplanner.protocol.api;

/** Page of open epics to import; {@code limit} and {@code startAt} fall back to 50 and 0. */
public record EpicImportRequest(String projectKey, Integer limit, Integer startAt) {

    public static final int DEFAULT_LIMIT = 50;

    public int limitOrDefault() {
        return limit != null ? limit : DEFAULT_LIMIT;
    }

    public int startAtOrDefault() {
        return startAt != null ? startAt : 0;
    }
}
