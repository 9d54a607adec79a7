package dev.reviewflow.repository;

import dev.reviewflow.domain.entity.Workflow;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WorkflowRepository {

    Workflow save(Workflow workflow);

    Optional<Workflow> findById(UUID id);

    List<Workflow> findByWorkspaceId(String workspaceId);
}
