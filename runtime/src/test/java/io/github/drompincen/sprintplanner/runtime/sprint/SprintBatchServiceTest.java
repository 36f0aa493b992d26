package io.github.drompincen.sprintplanner.runtime.sprint;

import io.github.drompincen.sprintplanner.persistence.document.SprintDocument;
import io.github.drompincen.sprintplanner.protocol.api.SprintBatchResult;
import io.github.drompincen.sprintplanner.protocol.api.SprintDefinition;
import io.github.drompincen.sprintplanner.protocol.api.SprintDto;
import io.github.drompincen.sprintplanner.runtime.error.ConflictException;
import io.github.drompincen.sprintplanner.runtime.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SprintBatchServiceTest {

    private static final Instant JUNE_2 = Instant.parse("2025-06-02T00:00:00Z");

    private InMemorySprintService sprints;
    private RegenerationGuardTest.MutableClock clock;
    private SprintBatchService service;

    @BeforeEach
    void setUp() {
        sprints = new InMemorySprintService();
        clock = new RegenerationGuardTest.MutableClock();
        RegenerationProperties properties = new RegenerationProperties();
        properties.setCooldown(Duration.ofSeconds(10));
        service = new SprintBatchService(sprints, new RegenerationGuard(properties, clock),
                new SnapshotTransactions(sprints));
    }

    private static SprintDefinition definition(String name, int weekOffset, Double velocity) {
        Instant start = JUNE_2.plus(Duration.ofDays(14L * weekOffset));
        return new SprintDefinition(name, start, start.plus(Duration.ofDays(14)).minusSeconds(1), velocity, null);
    }

    private static List<SprintDefinition> plan() {
        return List.of(
                definition("Sprint 1", 0, 20.0),
                definition("Sprint 2", 1, 22.0),
                definition("Sprint 3", 2, 24.0));
    }

    private SprintDocument existing(String name, int weekOffset, double velocity) {
        SprintDefinition d = definition(name, weekOffset, velocity);
        return sprints.create(d);
    }

    @Test
    void emptyBatchIsRejected() {
        assertThatThrownBy(() -> service.applyBatch(List.of(), true))
                .isInstanceOf(ValidationException.class)
                .hasMessage("sprints must be a non-empty array");
    }

    @Test
    void invalidDefinitionRejectsWholeBatch() {
        List<SprintDefinition> batch = new ArrayList<>(plan());
        batch.add(definition("Sprint 4", 3, null));

        assertThatThrownBy(() -> service.applyBatch(batch, true))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("plannedVelocity")
                .hasMessageContaining("Sprint 4");
        assertThat(sprints.all()).isEmpty();
    }

    @Test
    void invalidBatchDoesNotConsumeTheGuard() {
        List<SprintDefinition> batch = List.of(definition("Sprint 1", 0, null));
        assertThatThrownBy(() -> service.applyBatch(batch, true)).isInstanceOf(ValidationException.class);

        SprintBatchResult result = service.applyBatch(plan(), true);
        assertThat(result.sprints()).hasSize(3);
    }

    @Test
    void regenerationCreatesEverySprint() {
        SprintBatchResult result = service.applyBatch(plan(), true);

        assertThat(result.sprints()).extracting(SprintDto::name)
                .containsExactly("Sprint 1", "Sprint 2", "Sprint 3");
        assertThat(result.skipped()).isEmpty();
        assertThat(result.message()).isEqualTo("Batch operation completed: 3 sprints processed");
        assertThat(sprints.findActive()).hasSize(3);
    }

    @Test
    void regenerationTwiceLeavesOneSprintPerName() {
        service.applyBatch(plan(), true);
        clock.advance(Duration.ofSeconds(11));
        service.applyBatch(plan(), true);

        List<SprintDocument> active = sprints.findActive();
        assertThat(active).extracting(SprintDocument::getName)
                .containsExactly("Sprint 1", "Sprint 2", "Sprint 3");
        assertThat(active).extracting(SprintDocument::getPlannedVelocity)
                .containsExactly(20.0, 22.0, 24.0);
    }

    @Test
    void regenerationClearsOverlappingAndKeepsTheRest() {
        existing("Old Sprint", 1, 10);
        SprintDocument later = existing("Future Sprint", 10, 10);
        SprintDocument archived = existing("Archived Sprint", 1, 10);
        archived.setArchived(true);

        service.applyBatch(plan(), true);

        assertThat(sprints.all()).extracting(SprintDocument::getName)
                .contains("Future Sprint", "Archived Sprint")
                .doesNotContain("Old Sprint");
        assertThat(sprints.findById(later.getSprintId())).isPresent();
    }

    @Test
    void concurrentRegenerationConflictsThenCoolsDown() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        sprints.holdDeletes(entered, release);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SprintBatchResult> first = executor.submit(() -> service.applyBatch(plan(), true));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> service.applyBatch(plan(), true))
                    .isInstanceOf(ConflictException.class)
                    .hasMessageContaining("already in progress");

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).sprints()).hasSize(3);
        } finally {
            executor.shutdownNow();
        }

        assertThatThrownBy(() -> service.applyBatch(plan(), true))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("cooling down");

        clock.advance(Duration.ofSeconds(10));
        assertThat(service.applyBatch(plan(), true).sprints()).hasSize(3);
        assertThat(sprints.findActive()).hasSize(3);
    }

    @Test
    void failedRegenerationRollsBackAndSkipsCooldown() {
        existing("Sprint 1", 0, 5);
        sprints.failOnSaveOf("Sprint 3");

        assertThatThrownBy(() -> service.applyBatch(plan(), true)).isInstanceOf(IllegalStateException.class);

        assertThat(sprints.findActive()).extracting(SprintDocument::getName).containsExactly("Sprint 1");
        assertThat(sprints.findActive().get(0).getPlannedVelocity()).isEqualTo(5.0);

        sprints.failOnSaveOf(null);
        assertThat(service.applyBatch(plan(), true).sprints()).hasSize(3);
    }

    @Test
    void mergeUpdatesVelocityOfExactMatch() {
        SprintDocument sprint = existing("Sprint 1", 0, 10);
        Instant originalStart = sprint.getStartDate();

        SprintDefinition update = new SprintDefinition("Sprint 1", originalStart.plus(Duration.ofDays(3)),
                sprint.getEndDate(), 30.0, 28.0);
        SprintBatchResult result = service.applyBatch(List.of(update), false);

        assertThat(result.sprints()).singleElement().satisfies(dto -> {
            assertThat(dto.sprintId()).isEqualTo(sprint.getSprintId());
            assertThat(dto.plannedVelocity()).isEqualTo(30.0);
            assertThat(dto.actualVelocity()).isEqualTo(28.0);
            assertThat(dto.startDate()).isEqualTo(originalStart);
        });
        assertThat(sprints.findActive()).hasSize(1);
    }

    @Test
    void mergeKeepsActualVelocityWhenNotGiven() {
        SprintDocument sprint = existing("Sprint 1", 0, 10);
        sprint.setActualVelocity(9.0);

        service.applyBatch(List.of(definition("Sprint 1", 0, 12.0)), false);

        assertThat(sprints.findById(sprint.getSprintId()).orElseThrow().getActualVelocity()).isEqualTo(9.0);
    }

    @Test
    void mergeMatchesCaseInsensitiveNameWithSameDates() {
        SprintDocument sprint = existing("Sprint 7", 0, 10);

        service.applyBatch(List.of(definition("SPRINT 7", 0, 15.0)), false);

        assertThat(sprints.findActive()).singleElement().satisfies(s -> {
            assertThat(s.getSprintId()).isEqualTo(sprint.getSprintId());
            assertThat(s.getPlannedVelocity()).isEqualTo(15.0);
        });
    }

    @Test
    void mergeAcceptsSingleFuzzyMatch() {
        SprintDocument sprint = existing("Sprint 12", 0, 10);

        service.applyBatch(List.of(definition("Sprint 12 - Payments", 4, 18.0)), false);

        assertThat(sprints.findActive()).singleElement().satisfies(s -> {
            assertThat(s.getSprintId()).isEqualTo(sprint.getSprintId());
            assertThat(s.getName()).isEqualTo("Sprint 12");
            assertThat(s.getPlannedVelocity()).isEqualTo(18.0);
        });
    }

    @Test
    void mergeSkipsAmbiguousFuzzyMatch() {
        existing("Sprint 1", 0, 10);
        existing("Sprint 10", 1, 10);

        SprintBatchResult result = service.applyBatch(
                List.of(definition("Sprint", 2, 40.0), definition("Sprint 20", 3, 20.0)), false);

        assertThat(result.skipped()).containsExactly("Sprint");
        assertThat(result.message()).isEqualTo("Batch operation completed: 1 sprints processed, 1 skipped as ambiguous");
        assertThat(sprints.findActive()).extracting(SprintDocument::getPlannedVelocity)
                .containsExactly(10.0, 10.0, 20.0);
    }

    @Test
    void mergeDoesNotFuzzyMatchSprintsCreatedInSameBatch() {
        SprintBatchResult result = service.applyBatch(
                List.of(definition("Sprint 1", 0, 10.0), definition("Sprint 10", 1, 12.0)), false);

        assertThat(result.sprints()).extracting(SprintDto::name).containsExactly("Sprint 1", "Sprint 10");
        assertThat(sprints.findActive()).hasSize(2);
    }

    @Test
    void mergeFailureRollsBackEarlierWrites() {
        SprintDocument sprint = existing("Sprint 1", 0, 10);
        sprints.failOnSaveOf("Sprint 2");

        assertThatThrownBy(() -> service.applyBatch(
                List.of(definition("Sprint 1", 0, 50.0), definition("Sprint 2", 1, 12.0)), false))
                .isInstanceOf(IllegalStateException.class);

        assertThat(sprints.findById(sprint.getSprintId()).orElseThrow().getPlannedVelocity()).isEqualTo(10.0);
        assertThat(sprints.findActive()).hasSize(1);
    }

    @Test
    void fuzzyMatchesWorksBothDirections() {
        SprintDocument a = new SprintDocument();
        a.setName("Sprint 5");
        SprintDocument b = new SprintDocument();
        b.setName("Team Sprint 5 (Q3)");
        SprintDocument blank = new SprintDocument();
        blank.setName(" ");

        assertThat(SprintBatchService.fuzzyMatches("sprint 5", List.of(a, b, blank))).containsExactly(a, b);
        assertThat(SprintBatchService.fuzzyMatches("Payments Sprint 5", List.of(a, b))).containsExactly(a);
    }
}
