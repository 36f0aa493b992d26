package io.github.drompincen.sprintplanner.runtime.sprint;

import io.github.drompincen.sprintplanner.persistence.document.SprintDocument;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Sprint store backed by a map, with snapshot/restore standing in for transaction rollback. */
public class InMemorySprintService extends SprintService {

    private final Map<String, SprintDocument> sprints = new LinkedHashMap<>();
    private final Map<String, List<String>> assignments = new HashMap<>();
    private CountDownLatch deleteEntered;
    private CountDownLatch deleteRelease;
    private String failOnSaveOf;

    public InMemorySprintService() {
        super(null, null, null);
    }

    public synchronized Map<String, SprintDocument> snapshot() {
        Map<String, SprintDocument> copy = new LinkedHashMap<>();
        sprints.forEach((id, s) -> copy.put(id, copyOf(s)));
        return copy;
    }

    public synchronized void restore(Map<String, SprintDocument> snapshot) {
        sprints.clear();
        sprints.putAll(snapshot);
    }

    /** Parks the next regeneration inside its delete step until {@code release} opens. */
    public void holdDeletes(CountDownLatch entered, CountDownLatch release) {
        this.deleteEntered = entered;
        this.deleteRelease = release;
    }

    public void failOnSaveOf(String sprintName) {
        this.failOnSaveOf = sprintName;
    }

    public void assign(String sprintId, String workItemId) {
        assignments.computeIfAbsent(sprintId, k -> new ArrayList<>()).add(workItemId);
    }

    public synchronized List<SprintDocument> all() {
        return new ArrayList<>(sprints.values());
    }

    @Override
    public synchronized List<SprintDocument> findActive() {
        return sprints.values().stream()
                .filter(s -> !s.isArchived())
                .sorted(Comparator.comparing(SprintDocument::getStartDate))
                .toList();
    }

    @Override
    public List<SprintDocument> findActiveStartedBy(Instant instant) {
        return findActive().stream().filter(s -> !s.getStartDate().isAfter(instant)).toList();
    }

    @Override
    public synchronized Optional<SprintDocument> findById(String sprintId) {
        return Optional.ofNullable(sprints.get(sprintId));
    }

    @Override
    public Optional<SprintDocument> findActiveByName(String name) {
        return findActive().stream().filter(s -> s.getName().equals(name)).findFirst();
    }

    @Override
    public Map<String, List<String>> assignedWorkItemIds(Collection<String> sprintIds) {
        Map<String, List<String>> result = new HashMap<>();
        sprintIds.forEach(id -> result.put(id, assignments.getOrDefault(id, List.of())));
        return result;
    }

    @Override
    public synchronized SprintDocument save(SprintDocument sprint) {
        if (sprint.getName().equals(failOnSaveOf)) {
            throw new IllegalStateException("write failed for " + sprint.getName());
        }
        if (sprint.getSprintId() == null) {
            sprint.setSprintId(UUID.randomUUID().toString());
            sprint.setCreatedAt(Instant.now());
        }
        sprint.setUpdatedAt(Instant.now());
        sprints.put(sprint.getSprintId(), sprint);
        return sprint;
    }

    @Override
    public int deleteActiveByNamesOrOverlapping(Collection<String> names, Instant from, Instant to) {
        CountDownLatch entered = deleteEntered;
        if (entered != null) {
            deleteEntered = null;
            entered.countDown();
            try {
                deleteRelease.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
        synchronized (this) {
            List<String> doomed = sprints.values().stream()
                    .filter(s -> !s.isArchived())
                    .filter(s -> names.contains(s.getName())
                            || (!s.getStartDate().isAfter(to) && !s.getEndDate().isBefore(from)))
                    .map(SprintDocument::getSprintId)
                    .toList();
            doomed.forEach(id -> {
                sprints.remove(id);
                assignments.remove(id);
            });
            return doomed.size();
        }
    }

    static SprintDocument copyOf(SprintDocument s) {
        SprintDocument copy = new SprintDocument();
        copy.setSprintId(s.getSprintId());
        copy.setName(s.getName());
        copy.setStartDate(s.getStartDate());
        copy.setEndDate(s.getEndDate());
        copy.setPlannedVelocity(s.getPlannedVelocity());
        copy.setActualVelocity(s.getActualVelocity());
        copy.setArchived(s.isArchived());
        copy.setCreatedAt(s.getCreatedAt());
        copy.setUpdatedAt(s.getUpdatedAt());
        return copy;
    }
}
