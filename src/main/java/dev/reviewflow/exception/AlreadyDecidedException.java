package dev.reviewflow.exception;

import java.util.UUID;

public class AlreadyDecidedException extends ReviewFlowException {

    public AlreadyDecidedException(UUID requestId, int stepIndex, String assigneeId) {
        super("%s already decided step %d of review %s".formatted(assigneeId, stepIndex, requestId));
    }
}
