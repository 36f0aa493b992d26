package io.github.drompincen.sprintplanner.persistence.document;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SprintDocumentTest {

    @Test
    void sprintFieldsWork() {
        SprintDocument doc = new SprintDocument();
        Instant start = Instant.parse("2025-06-02T08:00:00Z");

        doc.setSprintId("s1");
        doc.setName("Sprint 12");
        doc.setStartDate(start);
        doc.setEndDate(start.plusSeconds(14 * 86400));
        doc.setPlannedVelocity(20);

        assertThat(doc.getName()).isEqualTo("Sprint 12");
        assertThat(doc.getPlannedVelocity()).isEqualTo(20);
        assertThat(doc.getActualVelocity()).isNull();
        assertThat(doc.isArchived()).isFalse();
    }

    @Test
    void assignmentFieldsWork() {
        SprintAssignmentDocument doc = new SprintAssignmentDocument();
        doc.setAssignmentId("a1");
        doc.setSprintId("s1");
        doc.setWorkItemId("w1");

        assertThat(doc.getSprintId()).isEqualTo("s1");
        assertThat(doc.getWorkItemId()).isEqualTo("w1");
        assertThat(doc.getAssignedAt()).isNull();
    }

    @Test
    void configFieldsWork() {
        SprintConfigDocument doc = new SprintConfigDocument();
        doc.setSprintDurationDays(14);
        doc.setDefaultVelocity(20);

        assertThat(doc.getSprintDurationDays()).isEqualTo(14);
        assertThat(doc.getDefaultVelocity()).isEqualTo(20);
    }
}
