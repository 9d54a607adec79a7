package dev.reviewflow.service;

import dev.reviewflow.domain.entity.Assignment;
import dev.reviewflow.domain.entity.ReviewActivity;
import dev.reviewflow.domain.entity.ReviewRequest;
import dev.reviewflow.domain.entity.Workflow;
import dev.reviewflow.domain.enums.ActivityType;
import dev.reviewflow.domain.enums.AssignmentStatus;
import dev.reviewflow.domain.enums.ReviewStatus;
import dev.reviewflow.domain.event.EscalationNotification;
import dev.reviewflow.domain.valueobject.ChangeRequestDetails;
import dev.reviewflow.domain.valueobject.Decision;
import dev.reviewflow.domain.valueobject.DecisionOutcome;
import dev.reviewflow.domain.valueobject.EscalationTally;
import dev.reviewflow.repository.ReviewRequestRepository;
import dev.reviewflow.support.EngineFixture;
import dev.reviewflow.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static dev.reviewflow.support.EngineFixture.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EscalationServiceTest {

    private EngineFixture engine;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
    }

    private ReviewRequest start(Workflow workflow) {
        return engine.reviewService.startReview(WORKSPACE, KNOWLEDGE, workflow.getId(), INITIATOR);
    }

    private Assignment assignmentOf(ReviewRequest request, String assigneeId) {
        return engine.reviews.findById(request.getId()).orElseThrow()
                .activeAssignmentFor(assigneeId).orElseThrow();
    }

    @Nested
    @DisplayName("runEscalations")
    class RunEscalations {

        @Test
        @DisplayName("escalates an assignment past its SLA and emits the overdue duration")
        void escalatesOverdue() {
            ReviewRequest request = start(engine.workflow(single(0, "peer", 1.0, "alice")));
            engine.clock.advance(Duration.ofMinutes(130));
            Instant now = engine.clock.instant();

            int escalated = engine.escalationService.runEscalations(now);

            assertThat(escalated).isEqualTo(1);
            Assignment assignment = assignmentOf(request, "alice");
            assertThat(assignment.getStatus()).isEqualTo(AssignmentStatus.ESCALATED);
            assertThat(assignment.getEscalatedAt()).isEqualTo(now);
            assertThat(engine.emitter.emitted()).singleElement()
                    .isInstanceOfSatisfying(EscalationNotification.class, n -> {
                        assertThat(n.assigneeId()).isEqualTo("alice");
                        assertThat(n.dueAt()).isEqualTo(T0.plus(Duration.ofHours(1)));
                        assertThat(n.overdueBy()).isEqualTo(Duration.ofMinutes(70));
                    });
            assertThat(engine.reviews.findById(request.getId()).orElseThrow().getActivity())
                    .extracting(ReviewActivity::getType)
                    .contains(ActivityType.ASSIGNMENT_ESCALATED);
        }

        @Test
        @DisplayName("an assignment due exactly now is overdue, one due a minute later is not")
        void dueBoundary() {
            start(engine.workflow(single(0, "peer", 1.0, "alice")));

            assertThat(engine.escalationService.runEscalations(T0.plus(Duration.ofMinutes(59)))).isZero();
            assertThat(engine.escalationService.runEscalations(T0.plus(Duration.ofMinutes(60)))).isEqualTo(1);
        }

        @Test
        @DisplayName("never escalates the same assignment twice")
        void monotonic() {
            start(engine.workflow(single(0, "peer", 1.0, "alice")));
            engine.clock.advance(Duration.ofHours(3));

            assertThat(engine.escalationService.runEscalations()).isEqualTo(1);
            engine.clock.advance(Duration.ofHours(3));
            assertThat(engine.escalationService.runEscalations()).isZero();
            assertThat(engine.emitter.emitted()).hasSize(1);
        }

        @Test
        @DisplayName("skips decided assignments and steps without SLA")
        void skipsDecidedAndUnbounded() {
            ReviewRequest bounded = start(engine.workflow(all(0, "board", 1.0, "alice", "bob")));
            start(engine.workflow(single(0, "peer", null, "carol")));
            engine.reviewService.recordDecision(WORKSPACE, bounded.getId(), "alice", Decision.approve());
            engine.clock.advance(Duration.ofDays(30));

            assertThat(engine.escalationService.runEscalations()).isEqualTo(1);
            assertThat(assignmentOf(bounded, "alice").getStatus()).isEqualTo(AssignmentStatus.DECIDED);
            assertThat(assignmentOf(bounded, "bob").getStatus()).isEqualTo(AssignmentStatus.ESCALATED);
        }

        @Test
        @DisplayName("leaves paused requests alone")
        void skipsPaused() {
            ReviewRequest request = start(engine.workflow(single(0, "peer", 1.0, "alice")));
            engine.reviewService.requestChanges(WORKSPACE, request.getId(), ChangeRequestDetails.none(), INITIATOR);
            engine.clock.advance(Duration.ofHours(2));

            assertThat(engine.escalationService.runEscalations()).isZero();
            assertThat(assignmentOf(request, "alice").getStatus()).isEqualTo(AssignmentStatus.PENDING);
        }

        @Test
        @DisplayName("does not change the request status")
        void statusUntouched() {
            ReviewRequest request = start(engine.workflow(single(0, "peer", 1.0, "alice")));
            engine.clock.advance(Duration.ofHours(2));

            engine.escalationService.runEscalations();

            ReviewRequest stored = engine.reviews.findById(request.getId()).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(ReviewStatus.IN_PROGRESS);
            assertThat(stored.getCurrentStepIndex()).isZero();
        }

        @Test
        @DisplayName("an escalated assignee can still decide")
        void lateDecision() {
            ReviewRequest request = start(engine.workflow(single(0, "peer", 1.0, "alice")));
            engine.clock.advance(Duration.ofHours(2));
            engine.escalationService.runEscalations();

            DecisionOutcome outcome = engine.reviewService.recordDecision(WORKSPACE, request.getId(), "alice", Decision.approve());

            assertThat(outcome).isEqualTo(new DecisionOutcome(ReviewStatus.APPROVED, true));
            assertThat(engine.escalationService.runEscalations()).isZero();
        }
    }

    @Nested
    @DisplayName("delivery failures")
    class DeliveryFailures {

        @Test
        @DisplayName("keeps an undelivered assignment PENDING and escalates the rest")
        void isolatesFailedEmit() {
            ReviewRequest request = start(engine.workflow(single(0, "peer", 1.0, "alice", "bob")));
            engine.emitter.failWhen(n -> n instanceof EscalationNotification e && e.assigneeId().equals("alice"));
            engine.clock.advance(Duration.ofHours(2));

            assertThat(engine.escalationService.runEscalations()).isEqualTo(1);
            assertThat(assignmentOf(request, "alice").getStatus()).isEqualTo(AssignmentStatus.PENDING);
            assertThat(assignmentOf(request, "bob").getStatus()).isEqualTo(AssignmentStatus.ESCALATED);
            assertThat(engine.meterRegistry.counter("reviewflow.escalations.failed").count()).isEqualTo(1.0);

            engine.emitter.failWhen(n -> false);
            assertThat(engine.escalationService.runEscalations()).isEqualTo(1);
            assertThat(assignmentOf(request, "alice").getStatus()).isEqualTo(AssignmentStatus.ESCALATED);
        }

        @Test
        @DisplayName("a failing request is skipped and the sweep continues")
        void isolatesFailedRequest() {
            ReviewRequestRepository repository = mock(ReviewRequestRepository.class);
            ReviewService reviewService = mock(ReviewService.class);
            UUID broken = UUID.randomUUID();
            UUID healthy = UUID.randomUUID();
            when(repository.findIdsWithOverdueAssignments(any())).thenReturn(List.of(broken, healthy));
            when(reviewService.escalateOverdueAssignments(eq(broken), any()))
                    .thenThrow(new IllegalStateException("lock timeout"));
            when(reviewService.escalateOverdueAssignments(eq(healthy), any()))
                    .thenReturn(new EscalationTally(2, 0));
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            EscalationService service = new EscalationService(repository, reviewService,
                    new MutableClock(T0), registry);

            assertThat(service.runEscalations()).isEqualTo(2);
            assertThat(registry.counter("reviewflow.escalations.triggered").count()).isEqualTo(2.0);
            assertThat(registry.timer("reviewflow.escalation.sweep").count()).isEqualTo(1);
        }
    }
}
