package dev.reviewflow.access;

import dev.reviewflow.exception.AccessDeniedException;

/**
 * Authorization collaborator. Called by the web layer before each operation;
 * the engine itself never consults it.
 */
public interface AccessGuard {

    boolean authorize(String userId, String workspaceId, GuardedAction action, String resourceId);

    default void check(String userId, String workspaceId, GuardedAction action, String resourceId) {
        if (!authorize(userId, workspaceId, action, resourceId))
            throw new AccessDeniedException(userId, workspaceId, action);
    }
}
