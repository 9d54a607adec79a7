package dev.reviewflow.domain.valueobject;

import dev.reviewflow.domain.enums.DecisionType;

/**
 * An assignee's verdict on the current step.
 */
public record Decision(DecisionType type, String comment) {
    public Decision {
        if (type == null) throw new IllegalArgumentException("decision required");
        if (comment != null && comment.isBlank()) comment = null;
        TextLimits.requireWithin("comment", comment, TextLimits.LONG_TEXT);
    }

    public static Decision approve() {
        return new Decision(DecisionType.APPROVE, null);
    }

    public static Decision reject(String comment) {
        return new Decision(DecisionType.REJECT, comment);
    }

    public static Decision requestChanges(String comment) {
        return new Decision(DecisionType.REQUEST_CHANGES, comment);
    }
}
