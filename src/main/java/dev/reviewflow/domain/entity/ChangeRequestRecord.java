package dev.reviewflow.domain.entity;

import dev.reviewflow.domain.enums.ChangeRequestStatus;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One change-request pause of a review. Version ids are opaque references
 * into the document versioning system.
 */
@Entity
@Table(name = "change_requests", indexes = {
        @Index(name = "idx_change_request_review", columnList = "review_request_id")
})
public class ChangeRequestRecord {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "review_request_id", nullable = false)
    private ReviewRequest reviewRequest;

    @Column(name = "step_index", nullable = false)
    private int stepIndex;

    @Column(name = "version_from_id", length = 128)
    private String versionFromId;

    @Column(name = "version_to_id", length = 128)
    private String versionToId;

    @Column(length = 4000)
    private String summary;

    @Column(name = "requested_by", length = 128)
    private String requestedBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ChangeRequestStatus status;

    @Column(name = "addressed_at")
    private Instant addressedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ChangeRequestRecord() {
    }

    static ChangeRequestRecord create(int stepIndex, String versionFromId, String versionToId,
                                      String summary, String requestedBy, Instant now) {
        ChangeRequestRecord c = new ChangeRequestRecord();
        c.id = UUID.randomUUID();
        c.stepIndex = stepIndex;
        c.versionFromId = versionFromId;
        c.versionToId = versionToId;
        c.summary = summary;
        c.requestedBy = requestedBy;
        c.status = ChangeRequestStatus.OPEN;
        c.createdAt = now;
        return c;
    }

    void setReviewRequest(ReviewRequest rr) {
        this.reviewRequest = rr;
    }

    void markAddressed(Instant now) {
        this.status = ChangeRequestStatus.ADDRESSED;
        this.addressedAt = now;
    }

    public boolean isOpen() {
        return status == ChangeRequestStatus.OPEN;
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

    public String getVersionFromId() {
        return versionFromId;
    }

    public String getVersionToId() {
        return versionToId;
    }

    public String getSummary() {
        return summary;
    }

    public String getRequestedBy() {
        return requestedBy;
    }

    public ChangeRequestStatus getStatus() {
        return status;
    }

    public Instant getAddressedAt() {
        return addressedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
