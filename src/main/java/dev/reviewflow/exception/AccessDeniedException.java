package dev.reviewflow.exception;

import dev.reviewflow.access.GuardedAction;

public class AccessDeniedException extends ReviewFlowException {

    public AccessDeniedException(String userId, String workspaceId, GuardedAction action) {
        super("%s may not %s in workspace %s".formatted(userId, action, workspaceId));
    }
}
