package dev.reviewflow.domain.enums;

/**
 * Lifecycle: PENDING → IN_PROGRESS → APPROVED | REJECTED,
 * IN_PROGRESS ⇄ CHANGES_REQUESTED (via reopen).
 */
public enum ReviewStatus {
    PENDING, IN_PROGRESS, CHANGES_REQUESTED, APPROVED, REJECTED;

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED;
    }
}
