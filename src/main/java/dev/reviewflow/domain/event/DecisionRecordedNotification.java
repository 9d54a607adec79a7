package dev.reviewflow.domain.event;

import dev.reviewflow.domain.enums.DecisionType;
import dev.reviewflow.domain.enums.ReviewStatus;

import java.time.Instant;
import java.util.UUID;

public record DecisionRecordedNotification(
        UUID requestId,
        int stepIndex,
        String assigneeId,
        DecisionType decision,
        ReviewStatus resultingStatus,
        Instant occurredAt
) implements ReviewNotification {
    @Override
    public String type() {
        return "decision.recorded";
    }
}
