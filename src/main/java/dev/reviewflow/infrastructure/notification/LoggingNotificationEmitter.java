package dev.reviewflow.infrastructure.notification;

import dev.reviewflow.domain.event.ReviewNotification;
import dev.reviewflow.service.NotificationEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/** Local development: notifications go to the log instead of SQS. */
@Component
@Profile("local")
public class LoggingNotificationEmitter implements NotificationEmitter {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationEmitter.class);

    @Override
    public void emit(ReviewNotification notification) {
        log.info("Notification {} for review {}: {}", notification.type(), notification.requestId(), notification);
    }
}
