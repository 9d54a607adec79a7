package dev.reviewflow.service;

import dev.reviewflow.domain.entity.Assignment;
import dev.reviewflow.domain.entity.ChangeRequestRecord;
import dev.reviewflow.domain.entity.ReviewRequest;
import dev.reviewflow.domain.entity.StepAssignee;
import dev.reviewflow.domain.entity.Workflow;
import dev.reviewflow.domain.entity.WorkflowStep;
import dev.reviewflow.domain.enums.ActivityType;
import dev.reviewflow.domain.enums.AssigneeType;
import dev.reviewflow.domain.enums.DecisionType;
import dev.reviewflow.domain.enums.ReviewStatus;
import dev.reviewflow.domain.event.DecisionRecordedNotification;
import dev.reviewflow.domain.event.EscalationNotification;
import dev.reviewflow.domain.event.ReviewConcludedNotification;
import dev.reviewflow.domain.event.ReviewNotification;
import dev.reviewflow.domain.event.StepAssignedNotification;
import dev.reviewflow.domain.valueobject.ChangeRequestDetails;
import dev.reviewflow.domain.valueobject.Decision;
import dev.reviewflow.domain.valueobject.DecisionOutcome;
import dev.reviewflow.domain.valueobject.EscalationTally;
import dev.reviewflow.domain.valueobject.TextLimits;
import dev.reviewflow.exception.NotAssigneeException;
import dev.reviewflow.exception.NotFoundException;
import dev.reviewflow.repository.ReviewRequestRepository;
import dev.reviewflow.repository.WorkflowRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Command side of the review engine: owns every status transition of a
 * {@link ReviewRequest}.
 *
 * <p>Each operation runs under the request's in-process lock and loads the
 * aggregate with a row lock, checks every precondition, then mutates and saves
 * once. Failures therefore never leave partial state behind, and two decisions
 * racing on the same step cannot both advance it.
 *
 * <p>Every command is scoped to the caller's workspace. A request or workflow of
 * another workspace is reported as not found.
 *
 * <p>Notifications are published as application events and delivered after
 * commit by {@link dev.reviewflow.infrastructure.notification.NotificationRelay}.
 * Escalation notifications are the exception: they are emitted inline so a
 * failed delivery keeps the assignment PENDING.
 */
@Service
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewRequestRepository repository;
    private final WorkflowRepository workflowRepository;
    private final AssigneeResolver assigneeResolver;
    private final NotificationEmitter notificationEmitter;
    private final ApplicationEventPublisher eventPublisher;
    private final RequestLocks locks;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public ReviewService(ReviewRequestRepository repository,
                         WorkflowRepository workflowRepository,
                         AssigneeResolver assigneeResolver,
                         NotificationEmitter notificationEmitter,
                         ApplicationEventPublisher eventPublisher,
                         RequestLocks locks,
                         Clock clock,
                         MeterRegistry meterRegistry) {
        this.repository = repository;
        this.workflowRepository = workflowRepository;
        this.assigneeResolver = assigneeResolver;
        this.notificationEmitter = notificationEmitter;
        this.eventPublisher = eventPublisher;
        this.locks = locks;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @Transactional
    public ReviewRequest startReview(String workspaceId, String knowledgeId, UUID workflowId, String initiatorId) {
        if (knowledgeId == null || knowledgeId.isBlank()) throw new IllegalArgumentException("knowledgeId required");
        if (initiatorId == null || initiatorId.isBlank()) throw new IllegalArgumentException("initiatorId required");
        TextLimits.requireWithin("workspaceId", workspaceId, TextLimits.WORKSPACE_ID);
        TextLimits.requireWithin("knowledgeId", knowledgeId, TextLimits.IDENTIFIER);
        TextLimits.requireWithin("initiatorId", initiatorId, TextLimits.IDENTIFIER);

        Workflow workflow = workflowRepository.findById(workflowId)
                .filter(w -> w.belongsTo(workspaceId))
                .orElseThrow(() -> NotFoundException.workflow(workflowId));
        StepPlan plan = planStep(workflow, 0, workspaceId);

        Instant now = clock.instant();
        ReviewRequest request = ReviewRequest.create(workspaceId, knowledgeId, workflowId, initiatorId, now);
        request.start(now);
        request.record(ActivityType.REVIEW_STARTED, initiatorId, "workflow=" + workflowId, now);
        List<ReviewNotification> notifications = new ArrayList<>();
        seed(request, plan, now, notifications);

        repository.save(request);
        notifications.forEach(eventPublisher::publishEvent);
        log.info("Started review {} of knowledge {} with workflow {} ({} step(s))",
                request.getId(), knowledgeId, workflowId, workflow.getSteps().size());
        return request;
    }

    @Transactional
    public DecisionOutcome recordDecision(String workspaceId, UUID requestId, String assigneeId, Decision decision) {
        return locks.withLock(requestId, () -> {
            ReviewRequest request = loadForUpdate(workspaceId, requestId);
            request.requireStatus("record a decision on", ReviewStatus.IN_PROGRESS);
            int stepIndex = request.getCurrentStepIndex();
            Assignment assignment = request.activeAssignmentFor(assigneeId)
                    .orElseThrow(() -> new NotAssigneeException(requestId, stepIndex, assigneeId));

            Workflow workflow = loadWorkflow(request.getWorkflowId());
            WorkflowStep step = stepOf(workflow, stepIndex);
            StepPlan nextStep = null;
            if (decision.type() == DecisionType.APPROVE && !workflow.isLastStep(stepIndex)) {
                nextStep = planStep(workflow, stepIndex + 1, request.getWorkspaceId());
            }

            Instant now = clock.instant();
            assignment.decide(decision.type(), decision.comment(), now);
            request.record(ActivityType.DECISION_RECORDED, assigneeId, decision.type().name(), now);
            List<ReviewNotification> notifications = new ArrayList<>();

            DecisionOutcome outcome = switch (decision.type()) {
                case REJECT -> {
                    request.reject(now);
                    request.record(ActivityType.REVIEW_REJECTED, assigneeId, decision.comment(), now);
                    yield new DecisionOutcome(ReviewStatus.REJECTED, false);
                }
                case REQUEST_CHANGES -> {
                    request.requestChanges(null, null, null, assigneeId, now);
                    request.record(ActivityType.CHANGES_REQUESTED, assigneeId, decision.comment(), now);
                    yield new DecisionOutcome(ReviewStatus.CHANGES_REQUESTED, false);
                }
                case APPROVE -> applyApproval(request, workflow, step, nextStep, assigneeId, now, notifications);
            };

            repository.save(request);
            meterRegistry.counter("reviewflow.decisions", "decision", decision.type().name()).increment();

            eventPublisher.publishEvent(new DecisionRecordedNotification(
                    requestId, stepIndex, assigneeId, decision.type(), outcome.status(), now));
            if (outcome.status() != ReviewStatus.IN_PROGRESS) {
                eventPublisher.publishEvent(new ReviewConcludedNotification(
                        requestId, request.getInitiatorId(), outcome.status(), now));
            }
            notifications.forEach(eventPublisher::publishEvent);

            log.info("Review {} step {}: {} by {} → {} (advanced={})",
                    requestId, stepIndex, decision.type(), assigneeId, outcome.status(), outcome.advanced());
            return outcome;
        });
    }

    @Transactional
    public ChangeRequestRecord requestChanges(String workspaceId, UUID requestId, ChangeRequestDetails details,
                                              String requestedBy) {
        TextLimits.requireWithin("requestedBy", requestedBy, TextLimits.IDENTIFIER);
        return locks.withLock(requestId, () -> {
            ReviewRequest request = loadForUpdate(workspaceId, requestId);
            Instant now = clock.instant();
            ChangeRequestRecord record = request.requestChanges(
                    details.versionFromId(), details.versionToId(), details.summary(), requestedBy, now);
            request.record(ActivityType.CHANGES_REQUESTED, requestedBy,
                    "%s → %s".formatted(details.versionFromId(), details.versionToId()), now);
            repository.save(request);

            eventPublisher.publishEvent(new ReviewConcludedNotification(
                    requestId, request.getInitiatorId(), ReviewStatus.CHANGES_REQUESTED, now));
            log.info("Changes requested on review {} at step {} ({} → {})", requestId,
                    request.getCurrentStepIndex(), details.versionFromId(), details.versionToId());
            return record;
        });
    }

    /**
     * Resumes a paused review at its current step. Every assignee gets a fresh
     * PENDING assignment; decisions from before the pause do not count.
     */
    @Transactional
    public ReviewRequest reopen(String workspaceId, UUID requestId, String actorId) {
        TextLimits.requireWithin("actorId", actorId, TextLimits.IDENTIFIER);
        return locks.withLock(requestId, () -> {
            ReviewRequest request = loadForUpdate(workspaceId, requestId);
            request.requireStatus("reopen", ReviewStatus.CHANGES_REQUESTED);
            Workflow workflow = loadWorkflow(request.getWorkflowId());
            StepPlan plan = planStep(workflow, request.getCurrentStepIndex(), request.getWorkspaceId());

            Instant now = clock.instant();
            request.reopen(now);
            request.record(ActivityType.REVIEW_REOPENED, actorId, "cycle=" + request.getCycle(), now);
            List<ReviewNotification> notifications = new ArrayList<>();
            seed(request, plan, now, notifications);
            repository.save(request);

            notifications.forEach(eventPublisher::publishEvent);
            log.info("Reopened review {} at step {} (cycle {})", requestId,
                    request.getCurrentStepIndex(), request.getCycle());
            return request;
        });
    }

    /**
     * Escalates the overdue PENDING assignments of one request. An assignment is
     * marked ESCALATED only once its notification was emitted.
     */
    @Transactional
    public EscalationTally escalateOverdueAssignments(UUID requestId, Instant now) {
        return locks.withLock(requestId, () -> {
            ReviewRequest request = loadForUpdate(requestId);
            int escalated = 0;
            int failed = 0;
            for (Assignment assignment : request.overdueAssignments(now)) {
                try {
                    notificationEmitter.emit(new EscalationNotification(requestId, assignment.getStepIndex(),
                            assignment.getAssigneeId(), assignment.getDueAt(), assignment.overdueBy(now), now));
                } catch (RuntimeException e) {
                    failed++;
                    log.warn("Escalation of {} on review {} not delivered, will retry: {}",
                            assignment.getAssigneeId(), requestId, e.getMessage());
                    continue;
                }
                assignment.markEscalated(now);
                request.record(ActivityType.ASSIGNMENT_ESCALATED, null,
                        "assignee=%s overdueBy=%s".formatted(assignment.getAssigneeId(), assignment.overdueBy(now)), now);
                escalated++;
                log.warn("Escalated {} on review {} step {} ({} overdue)", assignment.getAssigneeId(),
                        requestId, assignment.getStepIndex(), assignment.overdueBy(now));
            }
            if (escalated > 0) repository.save(request);
            return new EscalationTally(escalated, failed);
        });
    }

    // ── Internal ───────────────────────────────────────────────────

    /** Resolved assignees of one step, computed before any mutation. */
    private record StepPlan(WorkflowStep step, Map<String, AssigneeType> assignees) {}

    private DecisionOutcome applyApproval(ReviewRequest request, Workflow workflow, WorkflowStep step,
                                          StepPlan nextStep, String assigneeId, Instant now,
                                          List<ReviewNotification> notifications) {
        long approvals = request.activeApprovals();
        int active = request.activeAssignments().size();
        if (!step.isSatisfied(approvals, active)) {
            log.debug("Review {} step {}: {}/{} approvals ({} required), quorum not met",
                    request.getId(), step.getStepIndex(), approvals, active, step.getRequiredApprovals());
            return new DecisionOutcome(ReviewStatus.IN_PROGRESS, false);
        }
        if (workflow.isLastStep(step.getStepIndex())) {
            request.approve(now);
            request.record(ActivityType.REVIEW_APPROVED, assigneeId, null, now);
            return new DecisionOutcome(ReviewStatus.APPROVED, true);
        }
        request.advanceStep(now);
        request.record(ActivityType.STEP_ADVANCED, assigneeId, "from=" + step.getStepIndex(), now);
        seed(request, nextStep, now, notifications);
        return new DecisionOutcome(ReviewStatus.IN_PROGRESS, true);
    }

    private StepPlan planStep(Workflow workflow, int stepIndex, String workspaceId) {
        WorkflowStep step = stepOf(workflow, stepIndex);
        Map<String, AssigneeType> resolved = new LinkedHashMap<>();
        for (StepAssignee assignee : step.getAssignees()) {
            for (String userId : assigneeResolver.resolve(workspaceId, assignee)) {
                resolved.putIfAbsent(userId, assignee.getAssigneeType());
            }
        }
        if (resolved.isEmpty()) {
            throw new IllegalStateException("Step %d of workflow %s resolved to no assignees"
                    .formatted(stepIndex, workflow.getId()));
        }
        return new StepPlan(step, resolved);
    }

    private void seed(ReviewRequest request, StepPlan plan, Instant now, List<ReviewNotification> notifications) {
        Instant dueAt = plan.step().sla().map(now::plus).orElse(null);
        plan.assignees().forEach((userId, type) -> {
            request.assign(type, userId, dueAt, now);
            notifications.add(new StepAssignedNotification(request.getId(), request.getWorkspaceId(),
                    request.getCurrentStepIndex(), userId, dueAt, now));
        });
        request.record(ActivityType.STEP_ASSIGNED, null, "assignees=" + plan.assignees().size(), now);
    }

    private ReviewRequest loadForUpdate(UUID requestId) {
        return repository.findByIdForUpdate(requestId).orElseThrow(() -> NotFoundException.reviewRequest(requestId));
    }

    private ReviewRequest loadForUpdate(String workspaceId, UUID requestId) {
        ReviewRequest request = loadForUpdate(requestId);
        if (!request.belongsTo(workspaceId)) throw NotFoundException.reviewRequest(requestId);
        return request;
    }

    private Workflow loadWorkflow(UUID workflowId) {
        return workflowRepository.findById(workflowId).orElseThrow(() -> NotFoundException.workflow(workflowId));
    }

    private static WorkflowStep stepOf(Workflow workflow, int stepIndex) {
        return workflow.step(stepIndex).orElseThrow(() -> new IllegalStateException(
                "Workflow %s has no step %d".formatted(workflow.getId(), stepIndex)));
    }
}
