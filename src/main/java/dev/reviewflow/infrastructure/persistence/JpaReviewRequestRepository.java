package dev.reviewflow.infrastructure.persistence;

import dev.reviewflow.domain.entity.ReviewRequest;
import dev.reviewflow.domain.enums.AssignmentStatus;
import dev.reviewflow.domain.enums.ReviewStatus;
import dev.reviewflow.repository.ReviewRequestRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data backed review storage. Row locking relies on the caller's
 * transaction; see {@link dev.reviewflow.service.ReviewService}.
 */
@Repository
public class JpaReviewRequestRepository implements ReviewRequestRepository {
    private final ReviewRequestJpaRepository jpa;

    public JpaReviewRequestRepository(ReviewRequestJpaRepository jpa) {
        this.jpa = jpa;
    }

    @Override
    public ReviewRequest save(ReviewRequest request) {
        return jpa.save(request);
    }

    @Override
    public Optional<ReviewRequest> findById(UUID id) {
        return jpa.findById(id);
    }

    @Override
    public Optional<ReviewRequest> findByIdForUpdate(UUID id) {
        return jpa.findByIdForUpdate(id);
    }

    @Override
    public List<ReviewRequest> findByKnowledge(String workspaceId, String knowledgeId) {
        return jpa.findByWorkspaceIdAndKnowledgeIdOrderByCreatedAtDesc(workspaceId, knowledgeId);
    }

    @Override
    public List<UUID> findIdsWithOverdueAssignments(Instant now) {
        return jpa.findIdsWithDueAssignments(ReviewStatus.IN_PROGRESS, AssignmentStatus.PENDING, now);
    }
}
