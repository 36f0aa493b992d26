package io.github.drompincen.sprintplanner.persistence.repository;

import io.github.drompincen.sprintplanner.persistence.document.SprintDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SprintRepository extends MongoRepository<SprintDocument, String> {
    List<SprintDocument> findByArchivedFalseOrderByStartDateAsc();
    List<SprintDocument> findByArchivedFalseAndStartDateLessThanEqualOrderByStartDateAsc(Instant startedBy);
    Optional<SprintDocument> findFirstByNameAndArchivedFalse(String name);
}
