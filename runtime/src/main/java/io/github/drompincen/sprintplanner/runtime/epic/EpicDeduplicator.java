package io.github.drompincen.sprintplanner.runtime.epic;

import io.github.drompincen.sprintplanner.persistence.document.WorkItemDocument;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses epics imported more than once into the most recently created record.
 *
 * <p>A child's parent reference resolves through one lookup: by external id first,
 * then by internal id as a fallback. Both lookups cover every epic that ever
 * carried the id, so children of a discarded duplicate land under the survivor.
 */
public final class EpicDeduplicator {

    /** One output row. Only surviving epics carry children. */
    public record Entry(WorkItemDocument item, List<WorkItemDocument> children) {}

    private EpicDeduplicator() {}

    public static List<Entry> deduplicate(List<WorkItemDocument> items) {
        Map<String, WorkItemDocument> survivorByGroup = new LinkedHashMap<>();
        for (WorkItemDocument item : items) {
            if (!item.isEpic()) continue;
            survivorByGroup.merge(groupKey(item), item, EpicDeduplicator::later);
        }

        Map<String, WorkItemDocument> byExternalId = new HashMap<>();
        Map<String, WorkItemDocument> byInternalId = new HashMap<>();
        for (WorkItemDocument item : items) {
            if (!item.isEpic()) continue;
            WorkItemDocument survivor = survivorByGroup.get(groupKey(item));
            if (item.getExternalId() != null) {
                byExternalId.put(item.getExternalId(), survivor);
            }
            byInternalId.put(item.getWorkItemId(), survivor);
        }

        Map<WorkItemDocument, List<WorkItemDocument>> children = new IdentityHashMap<>();
        for (WorkItemDocument item : items) {
            if (item.isEpic() || item.getEpicId() == null) continue;
            WorkItemDocument parent = resolveParent(item.getEpicId(), byExternalId, byInternalId);
            if (parent != null) {
                children.computeIfAbsent(parent, k -> new ArrayList<>()).add(item);
            }
        }

        List<Entry> result = new ArrayList<>(items.size());
        for (WorkItemDocument item : items) {
            if (!item.isEpic()) {
                result.add(new Entry(item, List.of()));
            } else if (survivorByGroup.get(groupKey(item)) == item) {
                result.add(new Entry(item, children.getOrDefault(item, List.of())));
            }
        }
        return result;
    }

    static WorkItemDocument resolveParent(String epicRef,
                                          Map<String, WorkItemDocument> byExternalId,
                                          Map<String, WorkItemDocument> byInternalId) {
        WorkItemDocument parent = byExternalId.get(epicRef);
        return parent != null ? parent : byInternalId.get(epicRef);
    }

    private static String groupKey(WorkItemDocument epic) {
        return epic.getExternalId() != null ? "ext:" + epic.getExternalId() : "id:" + epic.getWorkItemId();
    }

    private static WorkItemDocument later(WorkItemDocument a, WorkItemDocument b) {
        return created(b).isAfter(created(a)) ? b : a;
    }

    private static Instant created(WorkItemDocument item) {
        return item.getCreatedAt() != null ? item.getCreatedAt() : Instant.MIN;
    }
}
