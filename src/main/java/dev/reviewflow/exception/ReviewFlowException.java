package dev.reviewflow.exception;

/**
 * Base of the engine's error taxonomy. Every subtype is raised before the
 * aggregate is mutated, so a failed operation leaves stored state unchanged.
 */
public abstract class ReviewFlowException extends RuntimeException {

    protected ReviewFlowException(String message) {
        super(message);
    }
}
