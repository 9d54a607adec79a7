package dev.reviewflow.domain.entity;

import dev.reviewflow.domain.enums.AssigneeType;
import dev.reviewflow.domain.enums.AssignmentStatus;
import dev.reviewflow.domain.enums.DecisionType;
import dev.reviewflow.exception.AlreadyDecidedException;
import dev.reviewflow.exception.InvalidTransitionException;
import jakarta.persistence.*;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One assignee's task on one step of one review cycle. Never deleted.
 */
@Entity
@Table(name = "assignments", indexes = {
        @Index(name = "idx_assignment_request_step", columnList = "review_request_id, step_index"),
        @Index(name = "idx_assignment_status_due", columnList = "status, due_at")
})
public class Assignment {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "review_request_id", nullable = false)
    private ReviewRequest reviewRequest;

    @Column(name = "step_index", nullable = false)
    private int stepIndex;

    @Column(nullable = false)
    private int cycle;

    @Enumerated(EnumType.STRING)
    @Column(name = "assignee_type", nullable = false, length = 10)
    private AssigneeType assigneeType;

    @Column(name = "assignee_id", nullable = false, length = 128)
    private String assigneeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AssignmentStatus status;

    @Column(name = "due_at")
    private Instant dueAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private DecisionType decision;

    @Column(name = "decision_comment", length = 4000)
    private String comment;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "escalated_at")
    private Instant escalatedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Assignment() {
    }

    static Assignment create(int stepIndex, int cycle, AssigneeType type, String assigneeId,
                             Instant dueAt, Instant now) {
        Assignment a = new Assignment();
        a.id = UUID.randomUUID();
        a.stepIndex = stepIndex;
        a.cycle = cycle;
        a.assigneeType = type;
        a.assigneeId = assigneeId;
        a.status = AssignmentStatus.PENDING;
        a.dueAt = dueAt;
        a.createdAt = now;
        return a;
    }

    /**
     * Records the assignee's verdict. An escalated assignment still accepts its
     * decision; escalation is advisory.
     */
    public void decide(DecisionType decision, String comment, Instant now) {
        if (status == AssignmentStatus.DECIDED)
            throw new AlreadyDecidedException(reviewRequest.getId(), stepIndex, assigneeId);
        if (status == AssignmentStatus.SUPERSEDED)
            throw new InvalidTransitionException("Assignment %s was superseded".formatted(id));
        this.status = AssignmentStatus.DECIDED;
        this.decision = decision;
        this.comment = comment;
        this.decidedAt = now;
    }

    public boolean isOverdue(Instant now) {
        return status == AssignmentStatus.PENDING && dueAt != null && !dueAt.isAfter(now);
    }

    public Duration overdueBy(Instant now) {
        return dueAt == null ? Duration.ZERO : Duration.between(dueAt, now);
    }

    /** PENDING → ESCALATED only; returns false for any other status. */
    public boolean markEscalated(Instant now) {
        if (status != AssignmentStatus.PENDING) return false;
        this.status = AssignmentStatus.ESCALATED;
        this.escalatedAt = now;
        return true;
    }

    void supersede() {
        if (status.isOpen()) this.status = AssignmentStatus.SUPERSEDED;
    }

    boolean isApproval() {
        return status == AssignmentStatus.DECIDED && decision == DecisionType.APPROVE;
    }

    void setReviewRequest(ReviewRequest rr) {
        this.reviewRequest = rr;
    }

    public UUID getId() {
        return id;
    }

    public UUID getRequestId() {
        return reviewRequest.getId();
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public int getCycle() {
        return cycle;
    }

    public AssigneeType getAssigneeType() {
        return assigneeType;
    }

    public String getAssigneeId() {
        return assigneeId;
    }

    public AssignmentStatus getStatus() {
        return status;
    }

    public Instant getDueAt() {
        return dueAt;
    }

    public DecisionType getDecision() {
        return decision;
    }

    public String getComment() {
        return comment;
    }

    public Instant getDecidedAt() {
        return decidedAt;
    }

    public Instant getEscalatedAt() {
        return escalatedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
