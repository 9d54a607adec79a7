package dev.reviewflow.domain.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Event handed to the notification collaborator. Content and delivery are the
 * collaborator's concern; the engine only says what happened.
 */
public interface ReviewNotification {

    UUID requestId();

    Instant occurredAt();

    /** Stable wire name, e.g. {@code step.assigned}. */
    String type();
}
