package dev.reviewflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * ReviewFlow: multi-step review and approval workflows for knowledge documents.
 *
 * <p>Architecture overview:
 * <pre>
 * WorkflowController → WorkflowService → workflows (Postgres)
 * ReviewController   → ReviewService (state machine, row-locked) → review_requests + children
 *                                    ↘ application events → NotificationRelay (after commit) → SQS
 * EscalationController / EscalationScheduler → EscalationService → ReviewService (per request) → SQS
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ReviewFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReviewFlowApplication.class, args);
    }
}
