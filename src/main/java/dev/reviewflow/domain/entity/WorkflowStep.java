package dev.reviewflow.domain.entity;

import dev.reviewflow.domain.enums.StepType;
import jakarta.persistence.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One stage of a workflow. Read-only once the owning workflow is created.
 */
@Entity
@Table(name = "workflow_steps", uniqueConstraints = {
        @UniqueConstraint(name = "uq_workflow_step_index", columnNames = {"workflow_id", "step_index"})
})
public class WorkflowStep {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "workflow_id", nullable = false)
    private Workflow workflow;

    @Column(name = "step_index", nullable = false)
    private int stepIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "step_type", nullable = false, length = 20)
    private StepType type;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "sla_hours")
    private Double slaHours;

    @Column(name = "required_approvals", nullable = false)
    private int requiredApprovals;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "workflow_step_assignees", joinColumns = @JoinColumn(name = "step_id"))
    @OrderColumn(name = "position")
    private List<StepAssignee> assignees = new ArrayList<>();

    protected WorkflowStep() {
    }

    public static WorkflowStep create(int stepIndex, StepType type, String name,
                                      Double slaHours, int requiredApprovals, List<StepAssignee> assignees) {
        WorkflowStep s = new WorkflowStep();
        s.id = UUID.randomUUID();
        s.stepIndex = stepIndex;
        s.type = type;
        s.name = name;
        s.slaHours = slaHours;
        s.requiredApprovals = requiredApprovals;
        s.assignees = new ArrayList<>(assignees);
        return s;
    }

    void setWorkflow(Workflow workflow) {
        this.workflow = workflow;
    }

    /** Soft deadline for assignments of this step, if it has an SLA. */
    public Optional<Duration> sla() {
        if (slaHours == null) return Optional.empty();
        return Optional.of(Duration.ofMillis(Math.round(slaHours * 3_600_000d)));
    }

    public UUID getId() {
        return id;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public StepType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public Double getSlaHours() {
        return slaHours;
    }

    public int getRequiredApprovals() {
        return requiredApprovals;
    }

    public boolean isSatisfied(long approvals, int activeAssignments) {
        return type.isSatisfied(approvals, activeAssignments, requiredApprovals);
    }

    public List<StepAssignee> getAssignees() {
        return List.copyOf(assignees);
    }
}
