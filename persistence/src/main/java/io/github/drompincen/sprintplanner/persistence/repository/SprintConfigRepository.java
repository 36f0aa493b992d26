package io.github.drompincen.sprintplanner.persistence.repository;

import io.github.drompincen.sprintplanner.persistence.document.SprintConfigDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface SprintConfigRepository extends MongoRepository<SprintConfigDocument, String> {
    Optional<SprintConfigDocument> findFirstByOrderByCreatedAtDesc();
}
