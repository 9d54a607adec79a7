package dev.reviewflow.domain.valueobject;

import dev.reviewflow.domain.enums.ReviewStatus;

/**
 * Result of recording a decision. {@code advanced} is true when the decision
 * satisfied its step, including the final step of an approved review.
 */
public record DecisionOutcome(ReviewStatus status, boolean advanced) {}
