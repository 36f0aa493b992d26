package io.github.drompincen.sprintplanner.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "sprints")
@CompoundIndex(name = "archived_start", def = "{'archived': 1, 'startDate': 1}")
public class SprintDocument {

    @Id
    private String sprintId;

    @Indexed
    private String name;
    private Instant startDate;
    private Instant endDate;
    private double plannedVelocity;
    private Double actualVelocity;
    private boolean archived;
    private Instant createdAt;
    private Instant updatedAt;

    public SprintDocument() {}

    public String getSprintId() { return sprintId; }
    public void setSprintId(String sprintId) { this.sprintId = sprintId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Instant getStartDate() { return startDate; }
    public void setStartDate(Instant startDate) { this.startDate = startDate; }

    public Instant getEndDate() { return endDate; }
    public void setEndDate(Instant endDate) { this.endDate = endDate; }

    public double getPlannedVelocity() { return plannedVelocity; }
    public void setPlannedVelocity(double plannedVelocity) { this.plannedVelocity = plannedVelocity; }

    public Double getActualVelocity() { return actualVelocity; }
    public void setActualVelocity(Double actualVelocity) { this.actualVelocity = actualVelocity; }

    public boolean isArchived() { return archived; }
    public void setArchived(boolean archived) { this.archived = archived; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
