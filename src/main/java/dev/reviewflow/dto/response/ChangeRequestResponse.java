package dev.reviewflow.dto.response;

import dev.reviewflow.domain.entity.ChangeRequestRecord;
import dev.reviewflow.domain.enums.ChangeRequestStatus;

import java.time.Instant;
import java.util.UUID;

public record ChangeRequestResponse(
        UUID id, UUID requestId, int stepIndex, String versionFromId, String versionToId,
        String summary, String requestedBy, ChangeRequestStatus status, Instant createdAt, Instant addressedAt
) {
    public static ChangeRequestResponse from(ChangeRequestRecord c) {
        return new ChangeRequestResponse(c.getId(), c.getRequestId(), c.getStepIndex(), c.getVersionFromId(),
                c.getVersionToId(), c.getSummary(), c.getRequestedBy(), c.getStatus(), c.getCreatedAt(), c.getAddressedAt());
    }
}
