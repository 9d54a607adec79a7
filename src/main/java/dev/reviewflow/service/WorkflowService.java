package dev.reviewflow.service;

import dev.reviewflow.domain.entity.StepAssignee;
import dev.reviewflow.domain.entity.Workflow;
import dev.reviewflow.domain.entity.WorkflowStep;
import dev.reviewflow.domain.valueobject.StepDefinition;
import dev.reviewflow.domain.valueobject.StepDefinition.AssigneeDefinition;
import dev.reviewflow.domain.valueobject.TextLimits;
import dev.reviewflow.exception.NotFoundException;
import dev.reviewflow.exception.WorkflowValidationException;
import dev.reviewflow.exception.WorkflowValidationException.Violation;
import dev.reviewflow.repository.WorkflowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Workflow definition store. Definitions are validated as a whole and are
 * read-only once created.
 */
@Service
public class WorkflowService {
    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);
    private final WorkflowRepository repository;
    private final Clock clock;

    public WorkflowService(WorkflowRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional
    public Workflow createWorkflow(String workspaceId, String name, List<StepDefinition> steps, String description) {
        List<Violation> violations = validate(workspaceId, name, steps);
        if (TextLimits.exceeds(description, TextLimits.DESCRIPTION)) {
            violations.add(tooLong("description", TextLimits.DESCRIPTION));
        }
        if (!violations.isEmpty()) {
            log.warn("Rejected workflow '{}' in workspace {}: {} violation(s)", name, workspaceId, violations.size());
            throw new WorkflowValidationException(violations);
        }

        List<WorkflowStep> entities = steps.stream()
                .map(s -> WorkflowStep.create(s.index(), s.type(), s.name().trim(), s.slaHours(),
                        s.requiredApprovalsOrDefault(),
                        s.assignees().stream()
                                .map(a -> new StepAssignee(a.assigneeType(), a.assigneeId().trim()))
                                .toList()))
                .toList();
        Workflow saved = repository.save(Workflow.create(workspaceId, name.trim(), description, entities, clock.instant()));
        log.info("Created workflow {} '{}' with {} step(s) in workspace {}",
                saved.getId(), saved.getName(), entities.size(), workspaceId);
        return saved;
    }

    /** A workflow of another workspace is reported as not found. */
    @Transactional(readOnly = true)
    public Workflow getWorkflow(String workspaceId, UUID id) {
        return repository.findById(id)
                .filter(w -> w.belongsTo(workspaceId))
                .orElseThrow(() -> NotFoundException.workflow(id));
    }

    @Transactional(readOnly = true)
    public List<Workflow> listWorkflows(String workspaceId) {
        return repository.findByWorkspaceId(workspaceId);
    }

    List<Violation> validate(String workspaceId, String name, List<StepDefinition> steps) {
        List<Violation> violations = new ArrayList<>();
        if (isBlank(workspaceId)) violations.add(new Violation("workspaceId", "must not be blank"));
        else if (workspaceId.length() > TextLimits.WORKSPACE_ID) violations.add(tooLong("workspaceId", TextLimits.WORKSPACE_ID));
        if (isBlank(name)) violations.add(new Violation("name", "must not be blank"));
        else if (name.trim().length() > TextLimits.NAME) violations.add(tooLong("name", TextLimits.NAME));
        if (steps == null || steps.isEmpty()) {
            violations.add(new Violation("steps", "at least one step is required"));
            return violations;
        }

        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            StepDefinition step = steps.get(i);
            String path = "steps[" + i + "]";
            if (step == null) {
                violations.add(new Violation(path, "must not be null"));
                continue;
            }
            if (step.index() == null) {
                violations.add(new Violation(path + ".index", "is required"));
            } else if (!seen.add(step.index())) {
                violations.add(new Violation(path + ".index", "duplicate index " + step.index()));
            }
            if (step.type() == null) violations.add(new Violation(path + ".type", "is required"));
            if (isBlank(step.name())) violations.add(new Violation(path + ".name", "must not be blank"));
            else if (step.name().trim().length() > TextLimits.NAME) violations.add(tooLong(path + ".name", TextLimits.NAME));
            if (step.slaHours() != null && !(step.slaHours() > 0 && Double.isFinite(step.slaHours()))) {
                violations.add(new Violation(path + ".slaHours", "must be a positive number"));
            }
            validateAssignees(path, step.assignees(), violations);
            validateRequiredApprovals(path, step, violations);
        }

        TreeSet<Integer> indices = new TreeSet<>(seen);
        boolean contiguous = indices.size() == steps.size()
                && indices.first() == 0
                && indices.last() == steps.size() - 1;
        if (!contiguous && !indices.isEmpty()) {
            violations.add(new Violation("steps", "indices must be contiguous from 0 to %d but were %s"
                    .formatted(steps.size() - 1, indices)));
        }
        return violations;
    }

    private void validateAssignees(String path, List<AssigneeDefinition> assignees, List<Violation> violations) {
        if (assignees == null || assignees.isEmpty()) {
            violations.add(new Violation(path + ".assignees", "at least one assignee is required"));
            return;
        }
        for (int j = 0; j < assignees.size(); j++) {
            AssigneeDefinition a = assignees.get(j);
            String apath = path + ".assignees[" + j + "]";
            if (a == null) {
                violations.add(new Violation(apath, "must not be null"));
                continue;
            }
            if (a.assigneeType() == null) violations.add(new Violation(apath + ".assigneeType", "is required"));
            if (isBlank(a.assigneeId())) violations.add(new Violation(apath + ".assigneeId", "must not be blank"));
            else if (a.assigneeId().trim().length() > TextLimits.IDENTIFIER) {
                violations.add(tooLong(apath + ".assigneeId", TextLimits.IDENTIFIER));
            }
        }
    }

    private void validateRequiredApprovals(String path, StepDefinition step, List<Violation> violations) {
        Integer required = step.requiredApprovals();
        if (required == null) return;
        int assignees = step.assignees() == null ? 0 : step.assignees().size();
        if (required < 1 || (assignees > 0 && required > assignees)) {
            violations.add(new Violation(path + ".requiredApprovals",
                    "must be between 1 and the number of assignees (%d)".formatted(assignees)));
        } else if (required > 1 && step.type() != null && !step.type().takesThreshold()) {
            violations.add(new Violation(path + ".requiredApprovals",
                    "only MULTI_APPROVAL steps take a threshold above 1"));
        }
    }

    private static Violation tooLong(String field, int max) {
        return new Violation(field, "must be at most %d characters".formatted(max));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
