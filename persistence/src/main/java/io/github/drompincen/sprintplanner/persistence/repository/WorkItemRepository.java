package io.github.drompincen.sprintplanner.persistence.repository;

import io.github.drompincen.sprintplanner.persistence.document.WorkItemDocument;
import io.github.drompincen.sprintplanner.protocol.api.WorkItemStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface WorkItemRepository extends MongoRepository<WorkItemDocument, String> {
    List<WorkItemDocument> findAllByOrderByCreatedAtAsc();
    Optional<WorkItemDocument> findFirstByExternalIdOrderByCreatedAtDesc(String externalId);
    List<WorkItemDocument> findByWorkItemIdInAndStatus(Collection<String> workItemIds, WorkItemStatus status);
    List<WorkItemDocument> findByDependencyIdsContaining(String workItemId);
}
