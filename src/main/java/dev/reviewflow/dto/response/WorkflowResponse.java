package dev.reviewflow.dto.response;

import dev.reviewflow.domain.entity.StepAssignee;
import dev.reviewflow.domain.entity.Workflow;
import dev.reviewflow.domain.entity.WorkflowStep;
import dev.reviewflow.domain.enums.AssigneeType;
import dev.reviewflow.domain.enums.StepType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record WorkflowResponse(
        UUID id, String workspaceId, String name, String description,
        List<StepSummary> steps, Instant createdAt
) {
    public record StepSummary(int index, StepType type, String name, Double slaHours,
                              int requiredApprovals, List<AssigneeSummary> assignees) {}

    public record AssigneeSummary(AssigneeType assigneeType, String assigneeId) {}

    public static WorkflowResponse from(Workflow w) {
        return new WorkflowResponse(w.getId(), w.getWorkspaceId(), w.getName(), w.getDescription(),
                w.getSteps().stream().map(WorkflowResponse::toSummary).toList(), w.getCreatedAt());
    }

    private static StepSummary toSummary(WorkflowStep s) {
        return new StepSummary(s.getStepIndex(), s.getType(), s.getName(), s.getSlaHours(), s.getRequiredApprovals(),
                s.getAssignees().stream().map(WorkflowResponse::toSummary).toList());
    }

    private static AssigneeSummary toSummary(StepAssignee a) {
        return new AssigneeSummary(a.getAssigneeType(), a.getAssigneeId());
    }
}
