package dev.reviewflow.dto.response;

import dev.reviewflow.domain.entity.Assignment;
import dev.reviewflow.domain.enums.AssigneeType;
import dev.reviewflow.domain.enums.AssignmentStatus;
import dev.reviewflow.domain.enums.DecisionType;

import java.time.Instant;
import java.util.UUID;

public record AssignmentResponse(
        UUID id, UUID requestId, int stepIndex, int cycle,
        AssigneeType assigneeType, String assigneeId, AssignmentStatus status,
        Instant dueAt, DecisionType decision, String comment,
        Instant decidedAt, Instant escalatedAt
) {
    public static AssignmentResponse from(Assignment a) {
        return new AssignmentResponse(a.getId(), a.getRequestId(), a.getStepIndex(), a.getCycle(),
                a.getAssigneeType(), a.getAssigneeId(), a.getStatus(), a.getDueAt(),
                a.getDecision(), a.getComment(), a.getDecidedAt(), a.getEscalatedAt());
    }
}
