package io.github.drompincen.sprintplanner.runtime.sprint;

import io.github.drompincen.sprintplanner.persistence.document.SprintDocument;
import io.github.drompincen.sprintplanner.protocol.api.MatchStrategy;

/** Outcome of attributing one ticket; {@code sprint} is null only for {@code NO_SPRINT_FOUND}. */
public record SprintMatch(SprintDocument sprint, MatchStrategy strategy) {

    public static SprintMatch none() {
        return new SprintMatch(null, MatchStrategy.NO_SPRINT_FOUND);
    }

    public boolean matched() {
        return sprint != null;
    }
}
