package dev.reviewflow.domain.event;

import dev.reviewflow.domain.enums.ReviewStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Sent to the initiator when a review is approved, rejected or paused for changes.
 */
public record ReviewConcludedNotification(
        UUID requestId,
        String initiatorId,
        ReviewStatus status,
        Instant occurredAt
) implements ReviewNotification {
    @Override
    public String type() {
        return "review.concluded";
    }
}
