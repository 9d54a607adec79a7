package dev.reviewflow.domain.entity;

import dev.reviewflow.domain.enums.ActivityType;
import dev.reviewflow.domain.valueobject.TextLimits;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/** Append-only audit entry of a review request. */
@Entity
@Table(name = "review_activity", indexes = {
        @Index(name = "idx_activity_review_seq", columnList = "review_request_id, sequence_no")
})
public class ReviewActivity {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "review_request_id", nullable = false)
    private ReviewRequest reviewRequest;

    @Column(name = "sequence_no", nullable = false)
    private int sequence;

    @Enumerated(EnumType.STRING)
    @Column(name = "activity_type", nullable = false, length = 30)
    private ActivityType type;

    @Column(name = "actor_id", length = 128)
    private String actorId;

    @Column(name = "step_index", nullable = false)
    private int stepIndex;

    @Column(length = TextLimits.ACTIVITY_DETAIL)
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ReviewActivity() {
    }

    static ReviewActivity create(int sequence, ActivityType type, String actorId,
                                 int stepIndex, String detail, Instant now) {
        ReviewActivity a = new ReviewActivity();
        a.id = UUID.randomUUID();
        a.sequence = sequence;
        a.type = type;
        a.actorId = actorId;
        a.stepIndex = stepIndex;
        a.detail = TextLimits.truncate(detail, TextLimits.ACTIVITY_DETAIL);
        a.createdAt = now;
        return a;
    }

    void setReviewRequest(ReviewRequest rr) {
        this.reviewRequest = rr;
    }

    public UUID getId() {
        return id;
    }

    public int getSequence() {
        return sequence;
    }

    public ActivityType getType() {
        return type;
    }

    public String getActorId() {
        return actorId;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public String getDetail() {
        return detail;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
