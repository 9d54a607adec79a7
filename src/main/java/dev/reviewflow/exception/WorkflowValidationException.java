package dev.reviewflow.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a workflow definition is malformed. Carries every violation
 * found, not just the first.
 */
public class WorkflowValidationException extends ReviewFlowException {

    private final List<Violation> violations;

    public WorkflowValidationException(List<Violation> violations) {
        super(violations.stream().map(v -> v.field() + ": " + v.message())
                .collect(Collectors.joining("; ", "Invalid workflow definition: ", "")));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public record Violation(String field, String message) {}
}
