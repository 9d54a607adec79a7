package dev.reviewflow.dto.response;

import dev.reviewflow.domain.entity.ReviewRequest;
import dev.reviewflow.domain.enums.ReviewStatus;

import java.time.Instant;
import java.util.UUID;

public record ReviewResponse(
        UUID id, String workspaceId, String knowledgeId, UUID workflowId, String initiatorId,
        ReviewStatus status, int currentStepIndex, int cycle,
        Instant createdAt, Instant updatedAt, Instant completedAt
) {
    public static ReviewResponse from(ReviewRequest r) {
        return new ReviewResponse(r.getId(), r.getWorkspaceId(), r.getKnowledgeId(), r.getWorkflowId(),
                r.getInitiatorId(), r.getStatus(), r.getCurrentStepIndex(), r.getCycle(),
                r.getCreatedAt(), r.getUpdatedAt(), r.getCompletedAt());
    }
}
