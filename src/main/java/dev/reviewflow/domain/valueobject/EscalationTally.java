package dev.reviewflow.domain.valueobject;

/** Per-request result of an escalation pass. */
public record EscalationTally(int escalated, int failed) {

    public static final EscalationTally NONE = new EscalationTally(0, 0);

    public EscalationTally plus(EscalationTally other) {
        return new EscalationTally(escalated + other.escalated, failed + other.failed);
    }
}
