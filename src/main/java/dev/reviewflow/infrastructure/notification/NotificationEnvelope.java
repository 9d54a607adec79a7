package dev.reviewflow.infrastructure.notification;

import dev.reviewflow.domain.event.ReviewNotification;

import java.time.Instant;

/** Wire format of one queued notification. */
public record NotificationEnvelope(String type, Instant occurredAt, ReviewNotification payload) {

    public static NotificationEnvelope of(ReviewNotification notification) {
        return new NotificationEnvelope(notification.type(), notification.occurredAt(), notification);
    }
}
