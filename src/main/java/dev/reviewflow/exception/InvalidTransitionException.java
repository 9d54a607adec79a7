package dev.reviewflow.exception;

import dev.reviewflow.domain.enums.ReviewStatus;

import java.util.Arrays;
import java.util.UUID;

public class InvalidTransitionException extends ReviewFlowException {

    public InvalidTransitionException(String message) {
        super(message);
    }

    public static InvalidTransitionException of(UUID requestId, String operation,
                                                ReviewStatus actual, ReviewStatus... allowed) {
        return new InvalidTransitionException("Cannot %s review %s in status %s (expected %s)"
                .formatted(operation, requestId, actual, Arrays.toString(allowed)));
    }
}
