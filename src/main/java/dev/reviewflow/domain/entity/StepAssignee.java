package dev.reviewflow.domain.entity;

import dev.reviewflow.domain.enums.AssigneeType;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

import java.util.Objects;

/**
 * Reference to a user or a role on a workflow step. Roles are resolved to
 * users by {@link dev.reviewflow.service.AssigneeResolver} when a step is seeded.
 */
@Embeddable
public class StepAssignee {

    @Enumerated(EnumType.STRING)
    @Column(name = "assignee_type", nullable = false, length = 10)
    private AssigneeType assigneeType;

    @Column(name = "assignee_id", nullable = false, length = 128)
    private String assigneeId;

    protected StepAssignee() {
    }

    public StepAssignee(AssigneeType assigneeType, String assigneeId) {
        this.assigneeType = assigneeType;
        this.assigneeId = assigneeId;
    }

    public static StepAssignee user(String userId) {
        return new StepAssignee(AssigneeType.USER, userId);
    }

    public static StepAssignee role(String roleId) {
        return new StepAssignee(AssigneeType.ROLE, roleId);
    }

    public AssigneeType getAssigneeType() {
        return assigneeType;
    }

    public String getAssigneeId() {
        return assigneeId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StepAssignee other)) return false;
        return assigneeType == other.assigneeType && Objects.equals(assigneeId, other.assigneeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assigneeType, assigneeId);
    }

    @Override
    public String toString() {
        return assigneeType + ":" + assigneeId;
    }
}
