package dev.reviewflow.access;

public enum GuardedAction {
    WORKFLOW_MANAGE,
    WORKFLOW_READ,
    REVIEW_START,
    REVIEW_READ,
    REVIEW_DECIDE,
    REVIEW_REQUEST_CHANGES,
    REVIEW_REOPEN,
    ESCALATION_RUN
}
