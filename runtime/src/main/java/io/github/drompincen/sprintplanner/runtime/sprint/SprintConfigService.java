package io.github.drompincen.sprintplanner.runtime.sprint;

import io.github.drompincen.sprintplanner.persistence.document.SprintConfigDocument;
import io.github.drompincen.sprintplanner.persistence.repository.SprintConfigRepository;
import io.github.drompincen.sprintplanner.protocol.api.SprintConfigDto;
import io.github.drompincen.sprintplanner.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.UUID;

/** The single planning configuration used to lay out new sprints. */
@Service
public class SprintConfigService {

    private static final Logger log = LoggerFactory.getLogger(SprintConfigService.class);

    static final int DEFAULT_DURATION_DAYS = 14;
    static final double DEFAULT_VELOCITY = 20;

    private final SprintConfigRepository configRepository;
    private final TransactionOperations transactions;

    public SprintConfigService(SprintConfigRepository configRepository, TransactionOperations transactions) {
        this.configRepository = configRepository;
        this.transactions = transactions;
    }

    /** Latest stored configuration, or defaults starting now when none was saved. */
    public SprintConfigDto getCurrent() {
        return configRepository.findFirstByOrderByCreatedAtDesc()
                .map(SprintConfigService::toDto)
                .orElseGet(() -> new SprintConfigDto(null, Instant.now(), DEFAULT_DURATION_DAYS,
                        DEFAULT_VELOCITY, null, null));
    }

    public SprintConfigDto save(SprintConfigDto request) {
        if (request.firstSprintStartDate() == null) {
            throw new ValidationException("firstSprintStartDate is required");
        }
        if (request.sprintDurationDays() <= 0) {
            throw new ValidationException("sprintDurationDays must be greater than 0");
        }
        if (request.defaultVelocity() <= 0) {
            throw new ValidationException("defaultVelocity must be greater than 0");
        }

        SprintConfigDocument config = new SprintConfigDocument();
        config.setConfigId(UUID.randomUUID().toString());
        config.setFirstSprintStartDate(request.firstSprintStartDate());
        config.setSprintDurationDays(request.sprintDurationDays());
        config.setDefaultVelocity(request.defaultVelocity());
        Instant now = Instant.now();
        config.setCreatedAt(now);
        config.setUpdatedAt(now);

        SprintConfigDocument saved = transactions.execute(status -> {
            configRepository.deleteAll();
            return configRepository.save(config);
        });
        log.info("[SprintConfig] saved start={} duration={}d velocity={}",
                saved.getFirstSprintStartDate(), saved.getSprintDurationDays(), saved.getDefaultVelocity());
        return toDto(saved);
    }

    static SprintConfigDto toDto(SprintConfigDocument config) {
        return new SprintConfigDto(
                config.getConfigId(),
                config.getFirstSprintStartDate(),
                config.getSprintDurationDays(),
                config.getDefaultVelocity(),
                config.getCreatedAt(),
                config.getUpdatedAt());
    }
}
