package dev.reviewflow.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reusable approval template: an ordered, contiguous, zero-indexed list of steps.
 * Never mutated after creation; review requests reference it by id.
 */
@Entity
@Table(name = "workflows", indexes = {
        @Index(name = "idx_workflow_workspace", columnList = "workspace_id")
})
public class Workflow {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "workspace_id", nullable = false, length = 64)
    private String workspaceId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 2000)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @OneToMany(mappedBy = "workflow", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("stepIndex ASC")
    private List<WorkflowStep> steps = new ArrayList<>();

    protected Workflow() {
    }

    /**
     * Steps are expected to be validated already; they are stored in index order.
     */
    public static Workflow create(String workspaceId, String name, String description,
                                  List<WorkflowStep> steps, Instant now) {
        Workflow w = new Workflow();
        w.id = UUID.randomUUID();
        w.workspaceId = workspaceId;
        w.name = name;
        w.description = description;
        w.createdAt = now;
        steps.stream()
                .sorted(Comparator.comparingInt(WorkflowStep::getStepIndex))
                .forEach(step -> {
                    step.setWorkflow(w);
                    w.steps.add(step);
                });
        return w;
    }

    public Optional<WorkflowStep> step(int index) {
        return steps.stream().filter(s -> s.getStepIndex() == index).findFirst();
    }

    public boolean isLastStep(int index) {
        return index >= steps.size() - 1;
    }

    public boolean belongsTo(String workspaceId) {
        return this.workspaceId.equals(workspaceId);
    }

    public UUID getId() {
        return id;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public List<WorkflowStep> getSteps() {
        return List.copyOf(steps);
    }
}
