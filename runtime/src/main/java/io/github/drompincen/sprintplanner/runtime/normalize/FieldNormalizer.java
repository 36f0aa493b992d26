package io.github.drompincen.sprintplanner.runtime.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.sprintplanner.protocol.api.WorkItemStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps loosely typed tracker fields onto planner values. Every method is total:
 * bad input falls back to a default instead of failing the import.
 */
public final class FieldNormalizer {

    public static final double DEFAULT_STORY_POINTS = 1;
    public static final double MIN_STORY_POINTS = 0.5;
    public static final double MAX_STORY_POINTS = 20;

    /** Above this the value almost certainly came from the wrong field. */
    static final double GARBAGE_THRESHOLD = 100;

    public static final List<String> KNOWN_SKILLS = List.of("frontend", "backend");

    private static final Set<String> COMPLETED = Set.of("done", "closed", "resolved");
    private static final Set<String> IN_PROGRESS = Set.of("in progress", "in development", "in review");

    private FieldNormalizer() {}

    public static double normalizeStoryPoints(Object raw) {
        double value = toDouble(raw);
        if (Double.isNaN(value) || value > GARBAGE_THRESHOLD) {
            return DEFAULT_STORY_POINTS;
        }
        return Math.max(MIN_STORY_POINTS, Math.min(MAX_STORY_POINTS, value));
    }

    private static double toDouble(Object raw) {
        if (raw instanceof JsonNode node) {
            if (node.isNumber()) {
                return node.asDouble();
            }
            if (!node.isTextual()) {
                return DEFAULT_STORY_POINTS;
            }
            raw = node.asText();
        }
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.isEmpty() || trimmed.equals("None")) {
                return DEFAULT_STORY_POINTS;
            }
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return DEFAULT_STORY_POINTS;
            }
        }
        return DEFAULT_STORY_POINTS;
    }

    public static WorkItemStatus mapExternalStatus(String rawStatus) {
        if (rawStatus == null) {
            return WorkItemStatus.NOT_STARTED;
        }
        String status = rawStatus.trim().toLowerCase(Locale.ROOT);
        if (COMPLETED.contains(status)) {
            return WorkItemStatus.COMPLETED;
        }
        if (IN_PROGRESS.contains(status)) {
            return WorkItemStatus.IN_PROGRESS;
        }
        return WorkItemStatus.NOT_STARTED;
    }

    public static boolean isCompleted(String rawStatus) {
        return mapExternalStatus(rawStatus) == WorkItemStatus.COMPLETED;
    }

    /** Skill tags named by the labels; every known skill when none is named. */
    public static List<String> deriveSkills(List<String> labels) {
        List<String> skills = new ArrayList<>();
        if (labels != null) {
            for (String label : labels) {
                String tag = label == null ? "" : label.trim().toLowerCase(Locale.ROOT);
                if (KNOWN_SKILLS.contains(tag) && !skills.contains(tag)) {
                    skills.add(tag);
                }
            }
        }
        return skills.isEmpty() ? new ArrayList<>(KNOWN_SKILLS) : skills;
    }
}
