package dev.reviewflow.domain.entity;

import dev.reviewflow.domain.enums.ActivityType;
import dev.reviewflow.domain.enums.AssigneeType;
import dev.reviewflow.domain.enums.ReviewStatus;
import dev.reviewflow.exception.InvalidTransitionException;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Aggregate root for one approval run of a workflow against a knowledge document.
 *
 * Design: the request is the unit of serializability. Assignments, change-request
 * records and the activity log are children saved through the root; optimistic
 * locking (@Version) backs up the pessimistic lock taken by the engine.
 *
 * <p>A reopened request starts a new {@code cycle}; only assignments of the
 * current step and cycle are active.
 */
@Entity
@Table(name = "review_requests", indexes = {
        @Index(name = "idx_review_workspace_knowledge", columnList = "workspace_id, knowledge_id"),
        @Index(name = "idx_review_status", columnList = "status"),
        @Index(name = "idx_review_created", columnList = "created_at")
})
public class ReviewRequest {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "workspace_id", nullable = false, length = 64)
    private String workspaceId;

    @Column(name = "knowledge_id", nullable = false, length = 128)
    private String knowledgeId;

    @Column(name = "workflow_id", nullable = false, columnDefinition = "uuid")
    private UUID workflowId;

    @Column(name = "initiator_id", nullable = false, length = 128)
    private String initiatorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReviewStatus status;

    @Column(name = "current_step_index", nullable = false)
    private int currentStepIndex;

    @Column(nullable = false)
    private int cycle;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @OneToMany(mappedBy = "reviewRequest", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("cycle ASC, stepIndex ASC, createdAt ASC")
    private List<Assignment> assignments = new ArrayList<>();

    @OneToMany(mappedBy = "reviewRequest", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt ASC")
    private List<ChangeRequestRecord> changeRequests = new ArrayList<>();

    @OneToMany(mappedBy = "reviewRequest", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("sequence ASC")
    private List<ReviewActivity> activity = new ArrayList<>();

    protected ReviewRequest() {
    }

    public static ReviewRequest create(String workspaceId, String knowledgeId, UUID workflowId,
                                       String initiatorId, Instant now) {
        ReviewRequest r = new ReviewRequest();
        r.id = UUID.randomUUID();
        r.workspaceId = workspaceId;
        r.knowledgeId = knowledgeId;
        r.workflowId = workflowId;
        r.initiatorId = initiatorId;
        r.status = ReviewStatus.PENDING;
        r.currentStepIndex = 0;
        r.cycle = 0;
        r.createdAt = now;
        r.updatedAt = now;
        return r;
    }

    public void start(Instant now) {
        requireStatus("start", ReviewStatus.PENDING);
        this.status = ReviewStatus.IN_PROGRESS;
        touch(now);
    }

    /** Creates a PENDING assignment on the current step and cycle. */
    public Assignment assign(AssigneeType type, String assigneeId, Instant dueAt, Instant now) {
        Assignment a = Assignment.create(currentStepIndex, cycle, type, assigneeId, dueAt, now);
        a.setReviewRequest(this);
        assignments.add(a);
        return a;
    }

    public List<Assignment> activeAssignments() {
        return assignments.stream()
                .filter(a -> a.getStepIndex() == currentStepIndex && a.getCycle() == cycle)
                .toList();
    }

    public Optional<Assignment> activeAssignmentFor(String assigneeId) {
        return activeAssignments().stream()
                .filter(a -> a.getAssigneeId().equals(assigneeId))
                .findFirst();
    }

    public long activeApprovals() {
        return activeAssignments().stream().filter(Assignment::isApproval).count();
    }

    public List<Assignment> overdueAssignments(Instant now) {
        if (status != ReviewStatus.IN_PROGRESS) return List.of();
        return activeAssignments().stream().filter(a -> a.isOverdue(now)).toList();
    }

    public void advanceStep(Instant now) {
        requireStatus("advance", ReviewStatus.IN_PROGRESS);
        supersedeOpenAssignments();
        this.currentStepIndex++;
        touch(now);
    }

    public void approve(Instant now) {
        requireStatus("approve", ReviewStatus.IN_PROGRESS);
        supersedeOpenAssignments();
        this.status = ReviewStatus.APPROVED;
        this.completedAt = now;
        touch(now);
    }

    public void reject(Instant now) {
        requireStatus("reject", ReviewStatus.IN_PROGRESS);
        supersedeOpenAssignments();
        this.status = ReviewStatus.REJECTED;
        this.completedAt = now;
        touch(now);
    }

    /**
     * Pauses the review. Open assignments stay as they are until {@link #reopen}.
     */
    public ChangeRequestRecord requestChanges(String versionFromId, String versionToId, String summary,
                                              String requestedBy, Instant now) {
        requireStatus("request changes on", ReviewStatus.IN_PROGRESS);
        ChangeRequestRecord record = ChangeRequestRecord.create(
                currentStepIndex, versionFromId, versionToId, summary, requestedBy, now);
        record.setReviewRequest(this);
        changeRequests.add(record);
        this.status = ReviewStatus.CHANGES_REQUESTED;
        touch(now);
        return record;
    }

    /**
     * Resumes at the same step in a new cycle. Assignments of the paused cycle are
     * superseded and its open change requests marked addressed; the caller seeds
     * fresh assignments.
     */
    public void reopen(Instant now) {
        requireStatus("reopen", ReviewStatus.CHANGES_REQUESTED);
        supersedeOpenAssignments();
        changeRequests.stream().filter(ChangeRequestRecord::isOpen).forEach(c -> c.markAddressed(now));
        this.cycle++;
        this.status = ReviewStatus.IN_PROGRESS;
        touch(now);
    }

    public ReviewActivity record(ActivityType type, String actorId, String detail, Instant now) {
        ReviewActivity entry = ReviewActivity.create(activity.size(), type, actorId, currentStepIndex, detail, now);
        entry.setReviewRequest(this);
        activity.add(entry);
        return entry;
    }

    public boolean belongsTo(String workspaceId) {
        return this.workspaceId.equals(workspaceId);
    }

    public void requireStatus(String operation, ReviewStatus... allowed) {
        for (ReviewStatus s : allowed) {
            if (this.status == s) return;
        }
        throw InvalidTransitionException.of(id, operation, status, allowed);
    }

    private void supersedeOpenAssignments() {
        activeAssignments().forEach(Assignment::supersede);
    }

    private void touch(Instant now) {
        this.updatedAt = now;
    }

    // Getters
    public UUID getId() {
        return id;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getKnowledgeId() {
        return knowledgeId;
    }

    public UUID getWorkflowId() {
        return workflowId;
    }

    public String getInitiatorId() {
        return initiatorId;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public int getCurrentStepIndex() {
        return currentStepIndex;
    }

    public int getCycle() {
        return cycle;
    }

    public Long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public List<Assignment> getAssignments() {
        return List.copyOf(assignments);
    }

    public List<ChangeRequestRecord> getChangeRequests() {
        return List.copyOf(changeRequests);
    }

    public List<ReviewActivity> getActivity() {
        return List.copyOf(activity);
    }
}
