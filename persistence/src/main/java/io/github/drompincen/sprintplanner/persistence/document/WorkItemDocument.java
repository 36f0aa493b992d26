package io.github.drompincen.sprintplanner.persistence.document;

import io.github.drompincen.sprintplanner.protocol.api.WorkItemStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Document(collection = "work_items")
public class WorkItemDocument {

    @Id
    private String workItemId;

    @Indexed
    private String externalId;
    private String title;
    private String description;
    private String priority;
    private double storyPoints;
    private Instant requiredCompletionDate;
    private List<String> requiredSkills;
    private WorkItemStatus status;
    private String externalStatus;

    /** Parent epic reference: the epic's external id, or its internal id for local epics. */
    @Indexed
    private String epicId;
    private boolean epic;
    private List<String> dependencyIds;
    private Instant createdAt;
    private Instant updatedAt;

    public WorkItemDocument() {}

    public String getWorkItemId() { return workItemId; }
    public void setWorkItemId(String workItemId) { this.workItemId = workItemId; }

    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getPriority() { return priority; }
    public void setPriority(String priority) { this.priority = priority; }

    public double getStoryPoints() { return storyPoints; }
    public void setStoryPoints(double storyPoints) { this.storyPoints = storyPoints; }

    public Instant getRequiredCompletionDate() { return requiredCompletionDate; }
    public void setRequiredCompletionDate(Instant requiredCompletionDate) { this.requiredCompletionDate = requiredCompletionDate; }

    public List<String> getRequiredSkills() { return requiredSkills; }
    public void setRequiredSkills(List<String> requiredSkills) { this.requiredSkills = requiredSkills; }

    public WorkItemStatus getStatus() { return status; }
    public void setStatus(WorkItemStatus status) { this.status = status; }

    public String getExternalStatus() { return externalStatus; }
    public void setExternalStatus(String externalStatus) { this.externalStatus = externalStatus; }

    public String getEpicId() { return epicId; }
    public void setEpicId(String epicId) { this.epicId = epicId; }

    public boolean isEpic() { return epic; }
    public void setEpic(boolean epic) { this.epic = epic; }

    public List<String> getDependencyIds() { return dependencyIds; }
    public void setDependencyIds(List<String> dependencyIds) { this.dependencyIds = dependencyIds; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
