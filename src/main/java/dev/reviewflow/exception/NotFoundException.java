package dev.reviewflow.exception;

import java.util.UUID;

public class NotFoundException extends ReviewFlowException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException workflow(UUID id) {
        return new NotFoundException("Workflow not found: " + id);
    }

    public static NotFoundException reviewRequest(UUID id) {
        return new NotFoundException("Review request not found: " + id);
    }
}
