package io.github.drompincen.sprintplanner.runtime.sprint;

import io.github.drompincen.sprintplanner.persistence.document.SprintDocument;
import io.github.drompincen.sprintplanner.protocol.api.MatchStrategy;
import io.github.drompincen.sprintplanner.runtime.tracker.SprintTag;
import io.github.drompincen.sprintplanner.runtime.tracker.TrackerIssue;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Attributes a completed tracker ticket to one of the local sprints. Strategies are
 * tried in order and the first hit wins: sprint tag name, updated-date window,
 * most recently started sprint.
 */
@Component
public class SprintMatcher {

    private static final Comparator<SprintDocument> BY_START =
            Comparator.comparing(SprintDocument::getStartDate, Comparator.nullsFirst(Comparator.naturalOrder()));

    public SprintMatch match(TrackerIssue ticket, List<SprintDocument> candidates) {
        List<SprintDocument> active = candidates == null ? List.of()
                : candidates.stream().filter(s -> !s.isArchived()).toList();
        if (active.isEmpty()) {
            return SprintMatch.none();
        }

        Optional<SprintTag> tag = ticket.latestSprint();
        if (tag.isPresent()) {
            SprintDocument byName = matchByName(tag.get().name(), active);
            if (byName != null) {
                return new SprintMatch(byName, MatchStrategy.SPRINT_FIELD);
            }
        }

        SprintDocument byDate = matchByDate(ticket.updated(), active);
        if (byDate != null) {
            return new SprintMatch(byDate, MatchStrategy.DATE_RANGE);
        }

        SprintDocument latest = active.stream().max(BY_START).orElseThrow();
        return new SprintMatch(latest, MatchStrategy.LATEST_SPRINT_FALLBACK);
    }

    /** Exact case-insensitive name first, then containment either way preferring the longest name. */
    static SprintDocument matchByName(String tagName, List<SprintDocument> sprints) {
        if (tagName == null || tagName.isBlank()) {
            return null;
        }
        String wanted = normalize(tagName);
        for (SprintDocument sprint : sprints) {
            if (normalize(sprint.getName()).equals(wanted)) {
                return sprint;
            }
        }
        SprintDocument best = null;
        for (SprintDocument sprint : sprints) {
            String name = normalize(sprint.getName());
            if (name.isEmpty()) continue;
            if (name.contains(wanted) || wanted.contains(name)) {
                if (best == null || name.length() > normalize(best.getName()).length()) {
                    best = sprint;
                }
            }
        }
        return best;
    }

    /** Sprint whose inclusive window holds the timestamp; the latest-starting one if several do. */
    static SprintDocument matchByDate(Instant updated, List<SprintDocument> sprints) {
        if (updated == null) {
            return null;
        }
        return sprints.stream()
                .filter(s -> s.getStartDate() != null && s.getEndDate() != null)
                .filter(s -> !updated.isBefore(s.getStartDate()) && !updated.isAfter(s.getEndDate()))
                .max(BY_START)
                .orElse(null);
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
