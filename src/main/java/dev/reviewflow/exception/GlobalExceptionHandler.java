package dev.reviewflow.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.net.URI;
import java.time.Instant;

/**
 * Maps the engine's exceptions to RFC 7807 Problem Details.
 *
 * <p>Engine messages name ids and statuses only and are returned as the
 * {@code detail}. Unexpected exceptions are logged server-side and answered
 * with a generic 500. Spring MVC's own exceptions (missing header, unreadable
 * body, type mismatch) are handled by the base class.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(WorkflowValidationException.class)
    public ProblemDetail handleInvalidWorkflow(WorkflowValidationException ex) {
        log.warn("Invalid workflow: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, ex.getMessage(),
                "invalid-workflow", "Invalid Workflow Definition");
        problem.setProperty("violations", ex.getViolations());
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "bad-request", "Invalid Request");
    }

    @ExceptionHandler(NotFoundException.class)
    public ProblemDetail handleNotFound(NotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, ex.getMessage(), "not-found", "Not Found");
    }

    @ExceptionHandler(NotAssigneeException.class)
    public ProblemDetail handleNotAssignee(NotAssigneeException ex) {
        log.warn("Rejected decision: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, ex.getMessage(), "not-assignee", "Not an Assignee");
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDenied(AccessDeniedException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, ex.getMessage(), "access-denied", "Access Denied");
    }

    @ExceptionHandler(AlreadyDecidedException.class)
    public ProblemDetail handleAlreadyDecided(AlreadyDecidedException ex) {
        log.warn("Duplicate decision: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, ex.getMessage(), "already-decided", "Already Decided");
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ProblemDetail handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Invalid transition: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, ex.getMessage(), "invalid-transition", "Invalid State Transition");
    }

    @ExceptionHandler(ConcurrencyFailureException.class)
    public ProblemDetail handleConcurrentUpdate(ConcurrencyFailureException ex) {
        log.warn("Concurrent update: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "The review was modified concurrently. Please retry.",
                "concurrent-modification", "Concurrent Modification");
    }

    @ExceptionHandler(IllegalStateException.class)
    public ProblemDetail handleConflict(IllegalStateException ex) {
        log.warn("State conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, ex.getMessage(), "state-conflict", "State Conflict");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please try again later.", "internal", "Internal Server Error");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type, String title) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create("https://reviewflow.dev/errors/" + type));
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
