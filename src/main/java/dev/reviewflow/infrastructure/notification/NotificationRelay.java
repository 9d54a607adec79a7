package dev.reviewflow.infrastructure.notification;

import dev.reviewflow.domain.event.ReviewNotification;
import dev.reviewflow.service.NotificationEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Bridges engine notifications to the {@link NotificationEmitter}.
 *
 * <p>Runs after the engine transaction commits, so recipients never see a state
 * that was rolled back. Delivery is fire-and-forget: a failed emit is logged and
 * the committed transition stands. A crash between commit and emit loses the
 * notification; escalations do not go through here.
 */
@Component
public class NotificationRelay {
    private static final Logger log = LoggerFactory.getLogger(NotificationRelay.class);
    private final NotificationEmitter emitter;

    public NotificationRelay(NotificationEmitter emitter) {
        this.emitter = emitter;
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onNotification(ReviewNotification notification) {
        try {
            emitter.emit(notification);
        } catch (RuntimeException e) {
            log.warn("Dropped {} notification for review {}: {}",
                    notification.type(), notification.requestId(), e.getMessage());
        }
    }
}
