package dev.reviewflow.repository;

import dev.reviewflow.domain.entity.ReviewRequest;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage port for the review aggregate. Children (assignments, change requests,
 * activity) are persisted through the root.
 */
public interface ReviewRequestRepository {

    ReviewRequest save(ReviewRequest request);

    Optional<ReviewRequest> findById(UUID id);

    /**
     * Loads the aggregate for mutation. Database-backed implementations hold a
     * row lock until the surrounding transaction ends.
     */
    Optional<ReviewRequest> findByIdForUpdate(UUID id);

    List<ReviewRequest> findByKnowledge(String workspaceId, String knowledgeId);

    /**
     * Ids of IN_PROGRESS requests having at least one PENDING assignment on the
     * current step and cycle whose due time is at or before {@code now}.
     */
    List<UUID> findIdsWithOverdueAssignments(Instant now);
}
