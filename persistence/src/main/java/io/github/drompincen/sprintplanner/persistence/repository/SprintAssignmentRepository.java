package io.github.drompincen.sprintplanner.persistence.repository;

import io.github.drompincen.sprintplanner.persistence.document.SprintAssignmentDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SprintAssignmentRepository extends MongoRepository<SprintAssignmentDocument, String> {
    List<SprintAssignmentDocument> findBySprintId(String sprintId);
    List<SprintAssignmentDocument> findBySprintIdIn(Collection<String> sprintIds);
    List<SprintAssignmentDocument> findByWorkItemId(String workItemId);
    Optional<SprintAssignmentDocument> findBySprintIdAndWorkItemId(String sprintId, String workItemId);
    boolean existsBySprintIdAndWorkItemId(String sprintId, String workItemId);
    void deleteBySprintIdIn(Collection<String> sprintIds);
    void deleteByWorkItemId(String workItemId);
}
