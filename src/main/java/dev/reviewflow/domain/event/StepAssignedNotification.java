package dev.reviewflow.domain.event;

import java.time.Instant;
import java.util.UUID;

public record StepAssignedNotification(
        UUID requestId,
        String workspaceId,
        int stepIndex,
        String assigneeId,
        Instant dueAt,
        Instant occurredAt
) implements ReviewNotification {
    @Override
    public String type() {
        return "step.assigned";
    }
}
