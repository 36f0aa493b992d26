package io.github.drompincen.sprintplanner.runtime.sprint;

import io.github.drompincen.sprintplanner.persistence.document.SprintDocument;
import io.github.drompincen.sprintplanner.protocol.api.SprintBatchResult;
import io.github.drompincen.sprintplanner.protocol.api.SprintDefinition;
import io.github.drompincen.sprintplanner.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Applies a batch of sprint definitions in one transaction.
 *
 * <p>Regeneration mode replaces the planning horizon: every active sprint named in
 * the batch or overlapping its overall window is removed before the batch is
 * created. Merge mode updates velocities of matching sprints and creates the rest.
 */
@Service
public class SprintBatchService {

    private static final Logger log = LoggerFactory.getLogger(SprintBatchService.class);

    private final SprintService sprintService;
    private final RegenerationGuard guard;
    private final TransactionOperations transactions;

    public SprintBatchService(SprintService sprintService,
                              RegenerationGuard guard,
                              TransactionOperations transactions) {
        this.sprintService = sprintService;
        this.guard = guard;
        this.transactions = transactions;
    }

    /**
     * @throws ValidationException when the batch is empty or any definition is incomplete; nothing is written
     * @throws io.github.drompincen.sprintplanner.runtime.error.ConflictException in regeneration mode
     *         while another regeneration runs or during the cooldown
     */
    public SprintBatchResult applyBatch(List<SprintDefinition> definitions, boolean regeneration) {
        if (definitions == null || definitions.isEmpty()) {
            throw new ValidationException("sprints must be a non-empty array");
        }
        definitions.forEach(SprintService::validateDefinition);
        log.info("[Batch] processing {} sprints (regeneration: {})", definitions.size(), regeneration);

        if (!regeneration) {
            return transactions.execute(status -> merge(definitions));
        }

        guard.acquire();
        boolean success = false;
        try {
            SprintBatchResult result = transactions.execute(status -> regenerate(definitions));
            success = true;
            return result;
        } finally {
            guard.release(success);
        }
    }

    private SprintBatchResult regenerate(List<SprintDefinition> definitions) {
        Set<String> names = new LinkedHashSet<>();
        definitions.forEach(d -> names.add(d.name().trim()));
        Instant from = definitions.stream().map(SprintDefinition::startDate).min(Comparator.naturalOrder()).orElseThrow();
        Instant to = definitions.stream().map(SprintDefinition::endDate).max(Comparator.naturalOrder()).orElseThrow();

        int removed = sprintService.deleteActiveByNamesOrOverlapping(names, from, to);
        log.info("[Batch] cleared {} sprints in {} .. {} or named {}", removed, from, to, names);

        List<SprintDocument> sprints = new ArrayList<>(definitions.size());
        for (SprintDefinition definition : definitions) {
            Optional<SprintDocument> existing = sprintService.findActiveByName(definition.name().trim());
            if (existing.isPresent()) {
                log.warn("[Batch] sprint '{}' already exists after clearing, reusing it", definition.name());
                sprints.add(existing.get());
                continue;
            }
            sprints.add(sprintService.create(definition));
        }
        return new SprintBatchResult(sprintService.toDtos(sprints), List.of(),
                "Batch operation completed: " + sprints.size() + " sprints processed");
    }

    private SprintBatchResult merge(List<SprintDefinition> definitions) {
        // fuzzy matching only considers sprints that existed before this batch
        List<SprintDocument> existingBefore = sprintService.findActive();
        List<SprintDocument> sprints = new ArrayList<>(definitions.size());
        List<String> skipped = new ArrayList<>();

        for (SprintDefinition definition : definitions) {
            String name = definition.name().trim();
            Optional<SprintDocument> match = sprintService.findActiveByName(name)
                    .or(() -> sprintService.findActiveByNameIgnoreCaseAndDates(name,
                            definition.startDate(), definition.endDate()));

            if (match.isEmpty()) {
                List<SprintDocument> fuzzy = fuzzyMatches(name, existingBefore);
                if (fuzzy.size() == 1) {
                    match = Optional.of(fuzzy.get(0));
                } else if (fuzzy.size() > 1) {
                    match = fuzzy.stream().filter(s -> s.getName().equalsIgnoreCase(name)).findFirst();
                    if (match.isEmpty()) {
                        log.warn("[Batch] skipping '{}': ambiguous match against {}", name,
                                fuzzy.stream().map(SprintDocument::getName).toList());
                        skipped.add(name);
                        continue;
                    }
                }
            }

            if (match.isPresent()) {
                SprintDocument sprint = match.get();
                sprint.setPlannedVelocity(definition.plannedVelocity());
                if (definition.actualVelocity() != null) {
                    sprint.setActualVelocity(definition.actualVelocity());
                }
                log.info("[Batch] updating sprint '{}'", sprint.getName());
                sprints.add(sprintService.save(sprint));
            } else {
                log.info("[Batch] creating sprint '{}'", name);
                sprints.add(sprintService.create(definition));
            }
        }

        String message = "Batch operation completed: " + sprints.size() + " sprints processed";
        if (!skipped.isEmpty()) {
            message += ", " + skipped.size() + " skipped as ambiguous";
        }
        return new SprintBatchResult(sprintService.toDtos(sprints), skipped, message);
    }

    static List<SprintDocument> fuzzyMatches(String name, List<SprintDocument> sprints) {
        String wanted = name.toLowerCase(Locale.ROOT);
        return sprints.stream()
                .filter(s -> s.getName() != null && !s.getName().isBlank())
                .filter(s -> {
                    String candidate = s.getName().toLowerCase(Locale.ROOT);
                    return candidate.contains(wanted) || wanted.contains(candidate);
                })
                .toList();
    }
}
