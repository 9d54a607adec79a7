package dev.reviewflow.service;

import dev.reviewflow.domain.entity.StepAssignee;

import java.util.List;

/**
 * Membership collaborator: turns a step assignee into the concrete user ids
 * that receive assignments. Must be free of side effects.
 */
public interface AssigneeResolver {

    List<String> resolve(String workspaceId, StepAssignee assignee);
}
