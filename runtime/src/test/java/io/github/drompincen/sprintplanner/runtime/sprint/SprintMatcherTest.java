package io.github.drompincen.sprintplanner.runtime.sprint;

import io.github.drompincen.sprintplanner.persistence.document.SprintDocument;
import io.github.drompincen.sprintplanner.protocol.api.MatchStrategy;
import io.github.drompincen.sprintplanner.runtime.tracker.SprintTag;
import io.github.drompincen.sprintplanner.runtime.tracker.TrackerIssue;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static io.github.drompincen.sprintplanner.runtime.tracker.TrackerIssues.story;
import static org.assertj.core.api.Assertions.assertThat;

class SprintMatcherTest {

    private final SprintMatcher matcher = new SprintMatcher();

    static SprintDocument sprint(String id, String name, String start, String end) {
        SprintDocument sprint = new SprintDocument();
        sprint.setSprintId(id);
        sprint.setName(name);
        sprint.setStartDate(Instant.parse(start));
        sprint.setEndDate(Instant.parse(end));
        sprint.setPlannedVelocity(20);
        return sprint;
    }

    private static TrackerIssue ticket(Instant updated, String... sprintNames) {
        List<SprintTag> tags = java.util.Arrays.stream(sprintNames)
                .map(name -> new SprintTag(name, null, null, "closed"))
                .toList();
        return story("REF-1", "Done", 3, updated, List.of(), tags);
    }

    private final SprintDocument s11 = sprint("s11", "Sprint 11", "2025-05-19T00:00:00Z", "2025-06-01T23:59:59Z");
    private final SprintDocument s12 = sprint("s12", "Sprint 12", "2025-06-02T00:00:00Z", "2025-06-15T23:59:59Z");
    private final SprintDocument s13 = sprint("s13", "Sprint 13", "2025-06-16T00:00:00Z", "2025-06-29T23:59:59Z");

    @Test
    void containmentMatchesDecoratedSprintName() {
        SprintMatch match = matcher.match(ticket(null, "Sprint 12 (closed)"), List.of(s11, s12));

        assertThat(match.sprint()).isSameAs(s12);
        assertThat(match.strategy()).isEqualTo(MatchStrategy.SPRINT_FIELD);
    }

    @Test
    void lastSprintTagWins() {
        SprintMatch match = matcher.match(ticket(null, "Sprint 11", "sprint 13"), List.of(s11, s12, s13));

        assertThat(match.sprint()).isSameAs(s13);
    }

    @Test
    void exactMatchBeatsContainment() {
        SprintDocument s1 = sprint("s1", "Sprint 1", "2025-01-01T00:00:00Z", "2025-01-14T00:00:00Z");
        SprintDocument s10 = sprint("s10", "Sprint 10", "2025-05-01T00:00:00Z", "2025-05-14T00:00:00Z");

        assertThat(matcher.match(ticket(null, "sprint 1"), List.of(s10, s1)).sprint()).isSameAs(s1);
    }

    @Test
    void dateRangeMatchWhenNoTagMatches() {
        SprintMatch match = matcher.match(ticket(Instant.parse("2025-06-10T12:00:00Z"), "Unknown Sprint"),
                List.of(s11, s12, s13));

        assertThat(match.sprint()).isSameAs(s12);
        assertThat(match.strategy()).isEqualTo(MatchStrategy.DATE_RANGE);
    }

    @Test
    void dateRangeBoundsAreInclusive() {
        SprintMatch match = matcher.match(ticket(Instant.parse("2025-06-16T00:00:00Z")), List.of(s12, s13));

        assertThat(match.sprint()).isSameAs(s13);
    }

    @Test
    void fallsBackToMostRecentlyStartedSprint() {
        SprintMatch match = matcher.match(ticket(Instant.parse("2024-01-01T00:00:00Z")), List.of(s13, s11, s12));

        assertThat(match.sprint()).isSameAs(s13);
        assertThat(match.strategy()).isEqualTo(MatchStrategy.LATEST_SPRINT_FALLBACK);
    }

    @Test
    void noCandidatesIsTerminalClassification() {
        SprintMatch match = matcher.match(ticket(Instant.now(), "Sprint 12"), List.of());

        assertThat(match.matched()).isFalse();
        assertThat(match.strategy()).isEqualTo(MatchStrategy.NO_SPRINT_FOUND);
    }

    @Test
    void archivedSprintsAreIgnored() {
        s12.setArchived(true);

        SprintMatch match = matcher.match(ticket(null, "Sprint 12"), List.of(s12));

        assertThat(match.strategy()).isEqualTo(MatchStrategy.NO_SPRINT_FOUND);
    }
}
