package dev.reviewflow.infrastructure.persistence;

import dev.reviewflow.domain.entity.Workflow;
import dev.reviewflow.repository.WorkflowRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JpaWorkflowRepository implements WorkflowRepository {
    private final WorkflowJpaRepository jpa;

    public JpaWorkflowRepository(WorkflowJpaRepository jpa) {
        this.jpa = jpa;
    }

    @Override
    public Workflow save(Workflow workflow) {
        return jpa.save(workflow);
    }

    @Override
    public Optional<Workflow> findById(UUID id) {
        return jpa.findById(id);
    }

    @Override
    public List<Workflow> findByWorkspaceId(String workspaceId) {
        return jpa.findByWorkspaceIdOrderByCreatedAtAsc(workspaceId);
    }
}
