package dev.reviewflow.domain.event;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public record EscalationNotification(
        UUID requestId,
        int stepIndex,
        String assigneeId,
        Instant dueAt,
        Duration overdueBy,
        Instant occurredAt
) implements ReviewNotification {
    public EscalationNotification {
        if (requestId == null) throw new IllegalArgumentException("requestId required");
    }

    @Override
    public String type() {
        return "escalation.triggered";
    }
}
