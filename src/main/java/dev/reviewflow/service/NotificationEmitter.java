package dev.reviewflow.service;

import dev.reviewflow.domain.event.ReviewNotification;

/**
 * Notification collaborator. Implementations throw when delivery fails so the
 * escalation sweep can leave the assignment for the next run.
 */
public interface NotificationEmitter {

    void emit(ReviewNotification notification);
}
