package dev.reviewflow.infrastructure.persistence;

import dev.reviewflow.domain.entity.Workflow;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface WorkflowJpaRepository extends JpaRepository<Workflow, UUID> {
    List<Workflow> findByWorkspaceIdOrderByCreatedAtAsc(String workspaceId);
}
