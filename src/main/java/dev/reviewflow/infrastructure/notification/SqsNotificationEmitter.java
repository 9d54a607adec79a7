package dev.reviewflow.infrastructure.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.reviewflow.config.NotificationProperties;
import dev.reviewflow.domain.event.ReviewNotification;
import dev.reviewflow.service.NotificationEmitter;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Sends notifications to the SQS queue read by the notification service.
 *
 * <p>Failures propagate: the relay logs them, the escalation sweep leaves the
 * assignment PENDING. While the circuit is open calls fail fast with
 * {@code CallNotPermittedException}.
 */
@Component
@Profile("!local")
public class SqsNotificationEmitter implements NotificationEmitter {
    private static final Logger log = LoggerFactory.getLogger(SqsNotificationEmitter.class);

    private final SqsTemplate sqsTemplate;
    private final ObjectMapper objectMapper;
    private final String queueName;

    public SqsNotificationEmitter(SqsTemplate sqsTemplate, ObjectMapper objectMapper,
                                  NotificationProperties properties) {
        this.sqsTemplate = sqsTemplate;
        this.objectMapper = objectMapper;
        this.queueName = properties.queue();
    }

    @Override
    @CircuitBreaker(name = "notification-queue")
    public void emit(ReviewNotification notification) {
        String body;
        try {
            body = objectMapper.writeValueAsString(NotificationEnvelope.of(notification));
        } catch (JsonProcessingException e) {
            throw new NotificationDeliveryException(
                    "Cannot serialize %s for review %s".formatted(notification.type(), notification.requestId()), e);
        }
        sqsTemplate.send(queueName, body);
        log.debug("Queued {} for review {} on {}", notification.type(), notification.requestId(), queueName);
    }
}
