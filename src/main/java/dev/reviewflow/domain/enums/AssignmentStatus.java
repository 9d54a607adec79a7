package dev.reviewflow.domain.enums;

/**
 * PENDING → DECIDED, PENDING → ESCALATED → DECIDED.
 * Open assignments of a closed step or cycle become SUPERSEDED.
 */
public enum AssignmentStatus {
    PENDING, ESCALATED, DECIDED, SUPERSEDED;

    public boolean isOpen() {
        return this == PENDING || this == ESCALATED;
    }
}
