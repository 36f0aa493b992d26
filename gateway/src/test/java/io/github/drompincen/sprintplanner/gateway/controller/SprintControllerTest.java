package io.github.drompincen.sprintplanner.gateway.controller;

import io.github.drompincen.sprintplanner.persistence.document.SprintDocument;
import io.github.drompincen.sprintplanner.protocol.api.SprintBatchRequest;
import io.github.drompincen.sprintplanner.protocol.api.SprintBatchResult;
import io.github.drompincen.sprintplanner.protocol.api.SprintDefinition;
import io.github.drompincen.sprintplanner.protocol.api.SprintDto;
import io.github.drompincen.sprintplanner.runtime.error.ConflictException;
import io.github.drompincen.sprintplanner.runtime.sprint.SprintBatchService;
import io.github.drompincen.sprintplanner.runtime.sprint.SprintService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SprintControllerTest {

    private static final Instant START = Instant.parse("2025-06-02T00:00:00Z");
    private static final Instant END = Instant.parse("2025-06-15T23:59:59Z");

    @Mock private SprintService sprintService;
    @Mock private SprintBatchService sprintBatchService;

    private SprintController controller;

    @BeforeEach
    void setUp() {
        controller = new SprintController(sprintService, sprintBatchService);
        when(sprintService.toDto(any(SprintDocument.class)))
                .thenAnswer(inv -> SprintService.toDto(inv.getArgument(0), List.of()));
    }

    private SprintDocument makeSprint(String id, String name) {
        SprintDocument sprint = new SprintDocument();
        sprint.setSprintId(id);
        sprint.setName(name);
        sprint.setStartDate(START);
        sprint.setEndDate(END);
        sprint.setPlannedVelocity(20);
        return sprint;
    }

    @Test
    void createReturns201() {
        SprintDefinition definition = new SprintDefinition("Sprint 1", START, END, 20.0, null);
        when(sprintService.create(definition)).thenReturn(makeSprint("s1", "Sprint 1"));

        ResponseEntity<SprintDto> response = controller.create(definition);

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().sprintId()).isEqualTo("s1");
    }

    @Test
    void listReturnsActiveSprints() {
        List<SprintDocument> active = List.of(makeSprint("s1", "Sprint 1"), makeSprint("s2", "Sprint 2"));
        when(sprintService.findActive()).thenReturn(active);
        when(sprintService.toDtos(active)).thenReturn(active.stream()
                .map(s -> SprintService.toDto(s, List.of())).toList());

        assertThat(controller.list()).extracting(SprintDto::name).containsExactly("Sprint 1", "Sprint 2");
    }

    @Test
    void deleteArchives() {
        SprintDocument archived = makeSprint("s1", "Sprint 1");
        archived.setArchived(true);
        when(sprintService.archive("s1")).thenReturn(archived);

        SprintDto dto = controller.archive("s1");

        assertThat(dto.archived()).isTrue();
        verify(sprintService).archive("s1");
    }

    @Test
    void batchPassesRegenerationFlag() {
        List<SprintDefinition> sprints = List.of(new SprintDefinition("Sprint 1", START, END, 20.0, null));
        SprintBatchResult result = new SprintBatchResult(List.of(), List.of(), "Batch operation completed: 1 sprints processed");
        when(sprintBatchService.applyBatch(sprints, true)).thenReturn(result);

        assertThat(controller.batch(new SprintBatchRequest(sprints, true))).isSameAs(result);
        verify(sprintBatchService).applyBatch(sprints, true);
    }

    @Test
    void batchConflictPropagates() {
        when(sprintBatchService.applyBatch(any(), eq(true)))
                .thenThrow(new ConflictException("A sprint regeneration is already in progress", null));

        assertThatThrownBy(() -> controller.batch(new SprintBatchRequest(List.of(), true)))
                .isInstanceOf(ConflictException.class);
    }
}
