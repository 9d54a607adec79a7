package dev.reviewflow.domain.enums;

/** A change request is OPEN while its review is paused and ADDRESSED once the review is reopened. */
public enum ChangeRequestStatus {
    OPEN,
    ADDRESSED
}
