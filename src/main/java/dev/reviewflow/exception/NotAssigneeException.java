package dev.reviewflow.exception;

import java.util.UUID;

/** Caller holds no open assignment on the current step of the request. */
public class NotAssigneeException extends ReviewFlowException {

    public NotAssigneeException(UUID requestId, int stepIndex, String assigneeId) {
        super("%s has no open assignment on step %d of review %s".formatted(assigneeId, stepIndex, requestId));
    }
}
