package dev.reviewflow.dto.response;

import dev.reviewflow.domain.enums.ReviewStatus;
import dev.reviewflow.domain.valueobject.DecisionOutcome;

public record DecisionResponse(ReviewStatus status, boolean advanced) {
    public static DecisionResponse from(DecisionOutcome outcome) {
        return new DecisionResponse(outcome.status(), outcome.advanced());
    }
}
