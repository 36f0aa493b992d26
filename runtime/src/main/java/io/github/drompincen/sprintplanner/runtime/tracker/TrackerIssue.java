package io.github.drompincen.sprintplanner.runtime.tracker;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.sprintplanner.runtime.normalize.DocNode;
import io.github.drompincen.sprintplanner.runtime.normalize.RichText;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Typed view of one tracker issue. {@code rawStoryPoints} is kept unparsed; it
 * goes through {@code FieldNormalizer.normalizeStoryPoints} when consumed.
 */
public record TrackerIssue(
        String key,
        String summary,
        DocNode description,
        String statusName,
        String issueType,
        List<String> labels,
        JsonNode rawStoryPoints,
        List<String> fixVersions,
        List<SprintTag> sprints,
        String parentKey,
        Instant created,
        Instant updated
) {

    public String descriptionText() {
        return RichText.extractPlainText(description);
    }

    /** The most recent sprint association: trackers append, so the last one wins. */
    public Optional<SprintTag> latestSprint() {
        if (sprints == null || sprints.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(sprints.get(sprints.size() - 1));
    }

    public boolean isEpic() {
        return "Epic".equalsIgnoreCase(issueType);
    }
}
