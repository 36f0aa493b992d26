package io.github.drompincen.sprintplanner.runtime.sprint;

import io.github.drompincen.sprintplanner.persistence.document.SprintAssignmentDocument;
import io.github.drompincen.sprintplanner.persistence.document.SprintDocument;
import io.github.drompincen.sprintplanner.persistence.repository.SprintAssignmentRepository;
import io.github.drompincen.sprintplanner.persistence.repository.SprintRepository;
import io.github.drompincen.sprintplanner.protocol.api.SprintDefinition;
import io.github.drompincen.sprintplanner.protocol.api.SprintDto;
import io.github.drompincen.sprintplanner.runtime.error.NotFoundException;
import io.github.drompincen.sprintplanner.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class SprintService {

    private static final Logger log = LoggerFactory.getLogger(SprintService.class);

    private final SprintRepository sprintRepository;
    private final SprintAssignmentRepository assignmentRepository;
    private final MongoTemplate mongoTemplate;

    public SprintService(SprintRepository sprintRepository,
                         SprintAssignmentRepository assignmentRepository,
                         MongoTemplate mongoTemplate) {
        this.sprintRepository = sprintRepository;
        this.assignmentRepository = assignmentRepository;
        this.mongoTemplate = mongoTemplate;
    }

    // ---- Queries ----

    public List<SprintDocument> findActive() {
        return sprintRepository.findByArchivedFalseOrderByStartDateAsc();
    }

    /** Non-archived sprints that have already started, oldest first. */
    public List<SprintDocument> findActiveStartedBy(Instant instant) {
        return sprintRepository.findByArchivedFalseAndStartDateLessThanEqualOrderByStartDateAsc(instant);
    }

    public Optional<SprintDocument> findById(String sprintId) {
        return sprintRepository.findById(sprintId);
    }

    public SprintDocument getById(String sprintId) {
        return findById(sprintId).orElseThrow(() -> new NotFoundException("Sprint", sprintId));
    }

    public Optional<SprintDocument> findActiveByName(String name) {
        return sprintRepository.findFirstByNameAndArchivedFalse(name);
    }

    public Optional<SprintDocument> findActiveByNameIgnoreCaseAndDates(String name, Instant start, Instant end) {
        String wanted = name.toLowerCase(Locale.ROOT);
        return findActive().stream()
                .filter(s -> s.getName() != null && s.getName().toLowerCase(Locale.ROOT).equals(wanted))
                .filter(s -> start.equals(s.getStartDate()) && end.equals(s.getEndDate()))
                .findFirst();
    }

    /** Assigned work item ids per sprint; every requested id is present in the result. */
    public Map<String, List<String>> assignedWorkItemIds(Collection<String> sprintIds) {
        Map<String, List<String>> result = new HashMap<>();
        sprintIds.forEach(id -> result.put(id, new ArrayList<>()));
        if (sprintIds.isEmpty()) {
            return result;
        }
        for (SprintAssignmentDocument assignment : assignmentRepository.findBySprintIdIn(sprintIds)) {
            result.computeIfAbsent(assignment.getSprintId(), k -> new ArrayList<>()).add(assignment.getWorkItemId());
        }
        return result;
    }

    // ---- Mutations ----

    public SprintDocument save(SprintDocument sprint) {
        Instant now = Instant.now();
        if (sprint.getSprintId() == null) {
            sprint.setSprintId(UUID.randomUUID().toString());
        }
        if (sprint.getCreatedAt() == null) {
            sprint.setCreatedAt(now);
        }
        sprint.setUpdatedAt(now);
        return sprintRepository.save(sprint);
    }

    public SprintDocument create(SprintDefinition definition) {
        validateDefinition(definition);
        SprintDocument sprint = new SprintDocument();
        sprint.setName(definition.name().trim());
        sprint.setStartDate(definition.startDate());
        sprint.setEndDate(definition.endDate());
        sprint.setPlannedVelocity(definition.plannedVelocity());
        sprint.setActualVelocity(definition.actualVelocity());
        sprint.setArchived(false);
        return save(sprint);
    }

    /** Applies the non-null fields of {@code changes}. */
    public SprintDocument update(String sprintId, SprintDefinition changes) {
        SprintDocument sprint = getById(sprintId);
        if (changes.name() != null) {
            if (changes.name().isBlank()) {
                throw new ValidationException("Sprint name must not be blank");
            }
            sprint.setName(changes.name().trim());
        }
        if (changes.startDate() != null) sprint.setStartDate(changes.startDate());
        if (changes.endDate() != null) sprint.setEndDate(changes.endDate());
        if (changes.plannedVelocity() != null) {
            if (changes.plannedVelocity() <= 0) {
                throw new ValidationException("plannedVelocity must be greater than 0 for sprint: " + sprint.getName());
            }
            sprint.setPlannedVelocity(changes.plannedVelocity());
        }
        if (changes.actualVelocity() != null) sprint.setActualVelocity(changes.actualVelocity());
        if (sprint.getEndDate().isBefore(sprint.getStartDate())) {
            throw new ValidationException("endDate is before startDate for sprint: " + sprint.getName());
        }
        return save(sprint);
    }

    /** Soft delete: the sprint stays in the store but leaves every active query. */
    public SprintDocument archive(String sprintId) {
        SprintDocument sprint = getById(sprintId);
        sprint.setArchived(true);
        log.info("[Sprint] archived {} ({})", sprint.getName(), sprintId);
        return save(sprint);
    }

    /**
     * Removes non-archived sprints named in {@code names} or overlapping
     * [{@code from}, {@code to}], together with their assignment rows.
     *
     * @return number of sprints removed
     */
    public int deleteActiveByNamesOrOverlapping(Collection<String> names, Instant from, Instant to) {
        Query query = new Query(new Criteria().andOperator(
                Criteria.where("archived").is(false),
                new Criteria().orOperator(
                        Criteria.where("name").in(names),
                        new Criteria().andOperator(
                                Criteria.where("startDate").lte(to),
                                Criteria.where("endDate").gte(from)))));
        List<String> ids = mongoTemplate.find(query, SprintDocument.class).stream()
                .map(SprintDocument::getSprintId)
                .toList();
        if (ids.isEmpty()) {
            return 0;
        }
        assignmentRepository.deleteBySprintIdIn(ids);
        mongoTemplate.remove(new Query(Criteria.where("_id").in(ids)), SprintDocument.class);
        return ids.size();
    }

    // ---- Mapping ----

    public List<SprintDto> toDtos(List<SprintDocument> sprints) {
        Map<String, List<String>> assigned = assignedWorkItemIds(
                sprints.stream().map(SprintDocument::getSprintId).toList());
        return sprints.stream()
                .map(s -> toDto(s, assigned.getOrDefault(s.getSprintId(), List.of())))
                .toList();
    }

    public SprintDto toDto(SprintDocument sprint) {
        return toDtos(List.of(sprint)).get(0);
    }

    public static SprintDto toDto(SprintDocument sprint, List<String> workItemIds) {
        return new SprintDto(
                sprint.getSprintId(),
                sprint.getName(),
                sprint.getStartDate(),
                sprint.getEndDate(),
                sprint.getPlannedVelocity(),
                sprint.getActualVelocity(),
                sprint.isArchived(),
                List.copyOf(workItemIds),
                sprint.getCreatedAt(),
                sprint.getUpdatedAt());
    }

    /**
     * @throws ValidationException naming the sprint when a required field is missing or invalid
     */
    public static void validateDefinition(SprintDefinition definition) {
        if (definition == null) {
            throw new ValidationException("Sprint definition must not be null");
        }
        String label = definition.name() == null || definition.name().isBlank() ? "unnamed" : definition.name();
        List<String> missing = new ArrayList<>();
        if (definition.name() == null || definition.name().isBlank()) missing.add("name");
        if (definition.startDate() == null) missing.add("startDate");
        if (definition.endDate() == null) missing.add("endDate");
        if (definition.plannedVelocity() == null) missing.add("plannedVelocity");
        if (!missing.isEmpty()) {
            throw new ValidationException("Missing required fields " + missing + " for sprint: " + label,
                    "Every sprint needs name, startDate, endDate and plannedVelocity");
        }
        if (definition.plannedVelocity() <= 0) {
            throw new ValidationException("plannedVelocity must be greater than 0 for sprint: " + label);
        }
        if (definition.endDate().isBefore(definition.startDate())) {
            throw new ValidationException("endDate is before startDate for sprint: " + label);
        }
    }
}
