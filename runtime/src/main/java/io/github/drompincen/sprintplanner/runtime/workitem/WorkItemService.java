package io.github.drompincen.sprintplanner.runtime.workitem;

import io.github.drompincen.sprintplanner.persistence.document.SprintAssignmentDocument;
import io.github.drompincen.sprintplanner.persistence.document.WorkItemDocument;
import io.github.drompincen.sprintplanner.persistence.repository.SprintAssignmentRepository;
import io.github.drompincen.sprintplanner.persistence.repository.SprintRepository;
import io.github.drompincen.sprintplanner.persistence.repository.WorkItemRepository;
import io.github.drompincen.sprintplanner.protocol.api.CreateWorkItemRequest;
import io.github.drompincen.sprintplanner.protocol.api.WorkItemDto;
import io.github.drompincen.sprintplanner.protocol.api.WorkItemStatus;
import io.github.drompincen.sprintplanner.runtime.epic.EpicDeduplicator;
import io.github.drompincen.sprintplanner.runtime.error.NotFoundException;
import io.github.drompincen.sprintplanner.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class WorkItemService {

    private static final Logger log = LoggerFactory.getLogger(WorkItemService.class);

    static final double POINTS_GARBAGE_THRESHOLD = 100;
    static final double POINTS_CAP = 20;
    public static final String DEFAULT_PRIORITY = "Medium";

    private final WorkItemRepository workItemRepository;
    private final SprintAssignmentRepository assignmentRepository;
    private final SprintRepository sprintRepository;
    private final TransactionOperations transactions;

    public WorkItemService(WorkItemRepository workItemRepository,
                           SprintAssignmentRepository assignmentRepository,
                           SprintRepository sprintRepository,
                           TransactionOperations transactions) {
        this.workItemRepository = workItemRepository;
        this.assignmentRepository = assignmentRepository;
        this.sprintRepository = sprintRepository;
        this.transactions = transactions;
    }

    // ---- Queries ----

    /** Every work item, oldest first, with duplicate epics collapsed and children under their epic. */
    public List<WorkItemDto> listWithEpics() {
        List<WorkItemDocument> items = workItemRepository.findAllByOrderByCreatedAtAsc();
        Map<String, List<String>> sprintsByItem = new HashMap<>();
        for (SprintAssignmentDocument assignment : assignmentRepository.findAll()) {
            sprintsByItem.computeIfAbsent(assignment.getWorkItemId(), k -> new ArrayList<>())
                    .add(assignment.getSprintId());
        }

        List<WorkItemDto> result = new ArrayList<>(items.size());
        for (EpicDeduplicator.Entry entry : EpicDeduplicator.deduplicate(items)) {
            List<WorkItemDto> children = entry.children().isEmpty() ? null : entry.children().stream()
                    .map(child -> toDto(child, sprintsByItem.getOrDefault(child.getWorkItemId(), List.of()), null))
                    .toList();
            WorkItemDocument item = entry.item();
            result.add(toDto(item, sprintsByItem.getOrDefault(item.getWorkItemId(), List.of()), children));
        }
        return result;
    }

    public Optional<WorkItemDocument> findById(String workItemId) {
        return workItemRepository.findById(workItemId);
    }

    public WorkItemDocument getById(String workItemId) {
        return findById(workItemId).orElseThrow(() -> new NotFoundException("Work item", workItemId));
    }

    public WorkItemDto getDto(String workItemId) {
        return toDto(getById(workItemId));
    }

    /** Most recently created item imported under {@code externalId}. */
    public Optional<WorkItemDocument> findByExternalId(String externalId) {
        return workItemRepository.findFirstByExternalIdOrderByCreatedAtDesc(externalId);
    }

    public List<WorkItemDocument> findCompletedAssignedTo(String sprintId) {
        List<String> ids = assignmentRepository.findBySprintId(sprintId).stream()
                .map(SprintAssignmentDocument::getWorkItemId)
                .toList();
        if (ids.isEmpty()) {
            return List.of();
        }
        return workItemRepository.findByWorkItemIdInAndStatus(ids, WorkItemStatus.COMPLETED);
    }

    // ---- Mutations ----

    public WorkItemDocument save(WorkItemDocument item) {
        Instant now = Instant.now();
        if (item.getWorkItemId() == null) {
            item.setWorkItemId(UUID.randomUUID().toString());
        }
        if (item.getCreatedAt() == null) {
            item.setCreatedAt(now);
        }
        item.setUpdatedAt(now);
        return workItemRepository.save(item);
    }

    public WorkItemDto create(CreateWorkItemRequest request) {
        if (request.title() == null || request.title().isBlank()) {
            throw new ValidationException("title is required");
        }
        if (request.storyPoints() == null || request.storyPoints() <= 0) {
            throw new ValidationException("Story points must be greater than 0");
        }
        if (request.requiredCompletionDate() == null) {
            throw new ValidationException("requiredCompletionDate is required");
        }
        if (request.requiredSkills() == null || request.requiredSkills().isEmpty()) {
            throw new ValidationException("requiredSkills must contain at least one skill");
        }
        List<String> dependencies = distinct(request.dependencies());
        requireExisting(dependencies);

        WorkItemDocument item = new WorkItemDocument();
        item.setTitle(request.title().trim());
        item.setDescription(request.description());
        item.setPriority(request.priority() != null && !request.priority().isBlank()
                ? request.priority() : DEFAULT_PRIORITY);
        item.setStoryPoints(capPoints(request.storyPoints(), request.title()));
        item.setRequiredCompletionDate(request.requiredCompletionDate());
        item.setRequiredSkills(new ArrayList<>(request.requiredSkills()));
        item.setStatus(request.status() != null ? request.status() : WorkItemStatus.NOT_STARTED);
        item.setExternalId(request.externalId());
        item.setExternalStatus(request.externalStatus());
        item.setEpicId(request.epicId());
        item.setEpic(Boolean.TRUE.equals(request.epic()));
        item.setDependencyIds(dependencies);
        if (item.isEpic() && item.getEpicId() != null && item.getEpicId().equals(item.getExternalId())) {
            throw new ValidationException("An epic cannot be its own parent");
        }

        WorkItemDocument saved = save(item);
        log.info("[WorkItem] created {} '{}'", saved.getWorkItemId(), saved.getTitle());
        return toDto(saved, List.of(), null);
    }

    /** Applies the non-null fields of {@code request}; dependencies are replaced when given. */
    public WorkItemDto update(String workItemId, CreateWorkItemRequest request) {
        WorkItemDocument item = getById(workItemId);
        if (request.storyPoints() != null && request.storyPoints() <= 0) {
            throw new ValidationException("Story points must be greater than 0");
        }
        if (request.dependencies() != null) {
            if (request.dependencies().contains(workItemId)) {
                throw new ValidationException("Work item cannot depend on itself");
            }
            requireExisting(distinct(request.dependencies()));
        }
        if (request.requiredSkills() != null && request.requiredSkills().isEmpty()) {
            throw new ValidationException("requiredSkills must contain at least one skill");
        }

        if (request.title() != null && !request.title().isBlank()) item.setTitle(request.title().trim());
        if (request.description() != null) item.setDescription(request.description());
        if (request.priority() != null && !request.priority().isBlank()) item.setPriority(request.priority());
        if (request.storyPoints() != null) item.setStoryPoints(capPoints(request.storyPoints(), item.getTitle()));
        if (request.requiredCompletionDate() != null) item.setRequiredCompletionDate(request.requiredCompletionDate());
        if (request.requiredSkills() != null) item.setRequiredSkills(new ArrayList<>(request.requiredSkills()));
        if (request.status() != null) item.setStatus(request.status());
        if (request.externalId() != null) item.setExternalId(request.externalId());
        if (request.externalStatus() != null) item.setExternalStatus(request.externalStatus());
        if (request.epicId() != null) item.setEpicId(request.epicId());
        if (request.epic() != null) item.setEpic(request.epic());
        if (request.dependencies() != null) item.setDependencyIds(distinct(request.dependencies()));

        String epicRef = item.getEpicId();
        if (epicRef != null && (epicRef.equals(workItemId) || epicRef.equals(item.getExternalId()))) {
            throw new ValidationException("A work item cannot be its own parent epic");
        }
        return toDto(save(item));
    }

    /** Deletes the item, its sprint assignments and every dependency edge pointing at it. */
    public void delete(String workItemId) {
        getById(workItemId);
        transactions.executeWithoutResult(status -> {
            assignmentRepository.deleteByWorkItemId(workItemId);
            for (WorkItemDocument dependent : workItemRepository.findByDependencyIdsContaining(workItemId)) {
                List<String> remaining = new ArrayList<>(dependent.getDependencyIds());
                remaining.remove(workItemId);
                dependent.setDependencyIds(remaining);
                save(dependent);
            }
            workItemRepository.deleteById(workItemId);
        });
        log.info("[WorkItem] deleted {}", workItemId);
    }

    public WorkItemDto assign(String workItemId, String sprintId) {
        if (sprintId == null || sprintId.isBlank()) {
            throw new ValidationException("sprintId is required");
        }
        WorkItemDocument item = getById(workItemId);
        if (!sprintRepository.existsById(sprintId)) {
            throw new NotFoundException("Sprint", sprintId);
        }
        if (assignmentRepository.existsBySprintIdAndWorkItemId(sprintId, workItemId)) {
            throw new ValidationException("Work item " + workItemId + " is already assigned to sprint " + sprintId);
        }
        insertAssignment(workItemId, sprintId);
        return toDto(item);
    }

    public WorkItemDto unassign(String workItemId, String sprintId) {
        WorkItemDocument item = getById(workItemId);
        SprintAssignmentDocument assignment = assignmentRepository.findBySprintIdAndWorkItemId(sprintId, workItemId)
                .orElseThrow(() -> new NotFoundException("Sprint assignment", workItemId + "@" + sprintId));
        assignmentRepository.delete(assignment);
        return toDto(item);
    }

    /**
     * Assigns the item to the sprint unless it already is.
     *
     * @return true when a new assignment was written
     */
    public boolean ensureAssigned(String workItemId, String sprintId) {
        if (assignmentRepository.existsBySprintIdAndWorkItemId(sprintId, workItemId)) {
            return false;
        }
        insertAssignment(workItemId, sprintId);
        return true;
    }

    private void insertAssignment(String workItemId, String sprintId) {
        SprintAssignmentDocument assignment = new SprintAssignmentDocument();
        assignment.setAssignmentId(UUID.randomUUID().toString());
        assignment.setSprintId(sprintId);
        assignment.setWorkItemId(workItemId);
        assignment.setAssignedAt(Instant.now());
        assignmentRepository.save(assignment);
    }

    private static double capPoints(double points, String title) {
        if (points > POINTS_GARBAGE_THRESHOLD) {
            log.warn("[WorkItem] unreasonable story points {} for '{}', capping at {}", points, title, POINTS_CAP);
            return POINTS_CAP;
        }
        return points;
    }

    private void requireExisting(List<String> dependencyIds) {
        if (dependencyIds.isEmpty()) {
            return;
        }
        if (workItemRepository.findAllById(dependencyIds).size() != dependencyIds.size()) {
            throw new ValidationException("Some dependency work items do not exist");
        }
    }

    private static List<String> distinct(List<String> ids) {
        return ids == null ? new ArrayList<>() : new ArrayList<>(new LinkedHashSet<>(ids));
    }

    // ---- Mapping ----

    private WorkItemDto toDto(WorkItemDocument item) {
        List<String> sprintIds = assignmentRepository.findByWorkItemId(item.getWorkItemId()).stream()
                .map(SprintAssignmentDocument::getSprintId)
                .toList();
        return toDto(item, sprintIds, null);
    }

    static WorkItemDto toDto(WorkItemDocument item, List<String> sprintIds, List<WorkItemDto> children) {
        return new WorkItemDto(
                item.getWorkItemId(),
                item.getExternalId(),
                item.getTitle(),
                item.getDescription(),
                item.getPriority(),
                item.getStoryPoints(),
                item.getRequiredCompletionDate(),
                item.getRequiredSkills(),
                item.getStatus(),
                item.getExternalStatus(),
                item.getEpicId(),
                item.isEpic(),
                item.getDependencyIds() != null ? item.getDependencyIds() : List.of(),
                List.copyOf(sprintIds),
                children,
                item.getCreatedAt(),
                item.getUpdatedAt());
    }
}
