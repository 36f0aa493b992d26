package io.github.drompincen.sprintplanner.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "sprint_config")
public class SprintConfigDocument {

    @Id
    private String configId;
    private Instant firstSprintStartDate;
    private int sprintDurationDays;
    private double defaultVelocity;
    private Instant createdAt;
    private Instant updatedAt;

    public SprintConfigDocument() {}

    public String getConfigId() { return configId; }
    public void setConfigId(String configId) { this.configId = configId; }

    public Instant getFirstSprintStartDate() { return firstSprintStartDate; }
    public void setFirstSprintStartDate(Instant firstSprintStartDate) { this.firstSprintStartDate = firstSprintStartDate; }

    public int getSprintDurationDays() { return sprintDurationDays; }
    public void setSprintDurationDays(int sprintDurationDays) { this.sprintDurationDays = sprintDurationDays; }

    public double getDefaultVelocity() { return defaultVelocity; }
    public void setDefaultVelocity(double defaultVelocity) { this.defaultVelocity = defaultVelocity; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
