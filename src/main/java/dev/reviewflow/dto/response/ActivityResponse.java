package dev.reviewflow.dto.response;

import dev.reviewflow.domain.entity.ReviewActivity;
import dev.reviewflow.domain.enums.ActivityType;

import java.time.Instant;
import java.util.UUID;

public record ActivityResponse(
        UUID requestId, int sequence, ActivityType type, String actorId,
        int stepIndex, String detail, Instant createdAt
) {
    public static ActivityResponse from(UUID requestId, ReviewActivity a) {
        return new ActivityResponse(requestId, a.getSequence(), a.getType(), a.getActorId(),
                a.getStepIndex(), a.getDetail(), a.getCreatedAt());
    }
}
