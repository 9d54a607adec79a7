package dev.reviewflow.domain.enums;

public enum ActivityType {
    REVIEW_STARTED,
    STEP_ASSIGNED,
    DECISION_RECORDED,
    STEP_ADVANCED,
    REVIEW_APPROVED,
    REVIEW_REJECTED,
    CHANGES_REQUESTED,
    REVIEW_REOPENED,
    ASSIGNMENT_ESCALATED
}
