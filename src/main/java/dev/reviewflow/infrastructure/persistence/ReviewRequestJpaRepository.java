package dev.reviewflow.infrastructure.persistence;

import dev.reviewflow.domain.entity.ReviewRequest;
import dev.reviewflow.domain.enums.AssignmentStatus;
import dev.reviewflow.domain.enums.ReviewStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ReviewRequestJpaRepository extends JpaRepository<ReviewRequest, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("select r from ReviewRequest r where r.id = :id")
    Optional<ReviewRequest> findByIdForUpdate(@Param("id") UUID id);

    List<ReviewRequest> findByWorkspaceIdAndKnowledgeIdOrderByCreatedAtDesc(String workspaceId, String knowledgeId);

    @Query("""
            select distinct r.id from ReviewRequest r join r.assignments a
            where r.status = :status
              and a.status = :assignmentStatus
              and a.stepIndex = r.currentStepIndex
              and a.cycle = r.cycle
              and a.dueAt <= :now
            """)
    List<UUID> findIdsWithDueAssignments(@Param("status") ReviewStatus status,
                                         @Param("assignmentStatus") AssignmentStatus assignmentStatus,
                                         @Param("now") Instant now);
}
