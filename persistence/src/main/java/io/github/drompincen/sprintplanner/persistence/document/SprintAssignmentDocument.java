package io.github.drompincen.sprintplanner.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "sprint_work_items")
@CompoundIndex(name = "sprint_work_item", def = "{'sprintId': 1, 'workItemId': 1}", unique = true)
public class SprintAssignmentDocument {

    @Id
    private String assignmentId;
    private String sprintId;
    private String workItemId;
    private Instant assignedAt;

    public SprintAssignmentDocument() {}

    public String getAssignmentId() { return assignmentId; }
    public void setAssignmentId(String assignmentId) { this.assignmentId = assignmentId; }

    public String getSprintId() { return sprintId; }
    public void setSprintId(String sprintId) { this.sprintId = sprintId; }

    public String getWorkItemId() { return workItemId; }
    public void setWorkItemId(String workItemId) { this.workItemId = workItemId; }

    public Instant getAssignedAt() { return assignedAt; }
    public void setAssignedAt(Instant assignedAt) { this.assignedAt = assignedAt; }
}
