package dev.reviewflow.domain.valueobject;

import dev.reviewflow.domain.enums.AssigneeType;
import dev.reviewflow.domain.enums.StepType;

import java.util.List;

/**
 * Unvalidated input for one workflow step. Validation happens in
 * {@link dev.reviewflow.service.WorkflowService}, which reports every problem at once.
 *
 * <p>{@code requiredApprovals} is the quorum of a {@code MULTI_APPROVAL} step and
 * defaults to 1 when absent.
 */
public record StepDefinition(Integer index, StepType type, String name, Double slaHours,
                             List<AssigneeDefinition> assignees, Integer requiredApprovals) {

    public StepDefinition(Integer index, StepType type, String name, Double slaHours,
                          List<AssigneeDefinition> assignees) {
        this(index, type, name, slaHours, assignees, null);
    }

    public int requiredApprovalsOrDefault() {
        return requiredApprovals == null ? 1 : requiredApprovals;
    }

    public record AssigneeDefinition(AssigneeType assigneeType, String assigneeId) {

        public static AssigneeDefinition user(String userId) {
            return new AssigneeDefinition(AssigneeType.USER, userId);
        }

        public static AssigneeDefinition role(String roleId) {
            return new AssigneeDefinition(AssigneeType.ROLE, roleId);
        }
    }
}
