package dev.reviewflow.domain.enums;

public enum DecisionType {
    APPROVE, REJECT, REQUEST_CHANGES
}
