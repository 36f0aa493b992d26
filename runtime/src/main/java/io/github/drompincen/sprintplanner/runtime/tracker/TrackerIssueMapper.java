package io.github.drompincen.sprintplanner.runtime.tracker;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.sprintplanner.runtime.normalize.RichText;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw search-response issues into {@link TrackerIssue}s. Field ids for the
 * estimate and sprint custom fields come from {@link TrackerProperties}.
 */
@Component
public class TrackerIssueMapper {

    // 2025-07-01T10:15:30.000+0000
    private static final DateTimeFormatter TRACKER_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");
    private static final Pattern COMPACT_OFFSET = Pattern.compile("[+-]\\d{4}$");

    // key=value pairs inside "...Sprint@1a2b[id=37,state=CLOSED,name=Sprint 12,...]"
    private static final Pattern SPRINT_ATTRIBUTE = Pattern.compile("(\\w+)=(.*?)(?=,\\w+=|]?$)");

    private final TrackerProperties properties;

    public TrackerIssueMapper(TrackerProperties properties) {
        this.properties = properties;
    }

    /** Fields requested on every search so one mapping covers all callers. */
    public List<String> searchFields() {
        return List.of("summary", "description", "status", "issuetype", "labels", "fixVersions",
                "parent", "created", "updated",
                properties.getStoryPointsField(), properties.getSprintField());
    }

    public List<TrackerIssue> toIssues(JsonNode issues) {
        List<TrackerIssue> result = new ArrayList<>();
        if (issues == null || !issues.isArray()) {
            return result;
        }
        for (JsonNode issue : issues) {
            result.add(toIssue(issue));
        }
        return result;
    }

    public TrackerIssue toIssue(JsonNode issue) {
        JsonNode fields = issue.path("fields");
        JsonNode points = fields.get(properties.getStoryPointsField());
        return new TrackerIssue(
                issue.path("key").asText(),
                fields.path("summary").asText(""),
                RichText.parse(fields.get("description")),
                textOrNull(fields.path("status").path("name")),
                textOrNull(fields.path("issuetype").path("name")),
                strings(fields.path("labels")),
                points == null || points.isNull() ? null : points,
                names(fields.path("fixVersions")),
                sprints(fields.path(properties.getSprintField())),
                textOrNull(fields.path("parent").path("key")),
                parseTimestamp(textOrNull(fields.path("created"))),
                parseTimestamp(textOrNull(fields.path("updated"))));
    }

    List<SprintTag> sprints(JsonNode node) {
        List<SprintTag> tags = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return tags;
        }
        for (JsonNode entry : node) {
            SprintTag tag = entry.isTextual() ? parseSprintString(entry.asText()) : parseSprintObject(entry);
            if (tag != null && tag.name() != null && !tag.name().isBlank()) {
                tags.add(tag);
            }
        }
        return tags;
    }

    private SprintTag parseSprintObject(JsonNode entry) {
        if (!entry.isObject()) {
            return null;
        }
        return new SprintTag(
                textOrNull(entry.path("name")),
                parseTimestamp(textOrNull(entry.path("startDate"))),
                parseTimestamp(textOrNull(entry.path("endDate"))),
                textOrNull(entry.path("state")));
    }

    /** Older trackers serialize sprints as {@code Sprint@hash[key=value,...]} strings. */
    static SprintTag parseSprintString(String raw) {
        int open = raw.indexOf('[');
        String body = open >= 0 ? raw.substring(open + 1) : raw;
        Map<String, String> attributes = new HashMap<>();
        Matcher matcher = SPRINT_ATTRIBUTE.matcher(body);
        while (matcher.find()) {
            attributes.put(matcher.group(1), matcher.group(2));
        }
        String name = attributes.get("name");
        if (name == null) {
            return null;
        }
        return new SprintTag(name,
                parseTimestamp(attributes.get("startDate")),
                parseTimestamp(attributes.get("endDate")),
                attributes.get("state"));
    }

    /** ISO-8601, or the tracker's {@code +0000} offset form; anything else reads as absent. */
    static Instant parseTimestamp(String text) {
        if (text == null || text.isBlank() || text.equals("<null>")) {
            return null;
        }
        DateTimeFormatter format = COMPACT_OFFSET.matcher(text).find()
                ? TRACKER_TIMESTAMP
                : DateTimeFormatter.ISO_OFFSET_DATE_TIME;
        try {
            return OffsetDateTime.parse(text, format).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(v -> values.add(v.asText()));
        }
        return values;
    }

    private static List<String> names(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode v : node) {
                String name = textOrNull(v.path("name"));
                if (name != null) {
                    values.add(name);
                }
            }
        }
        return values;
    }
}
