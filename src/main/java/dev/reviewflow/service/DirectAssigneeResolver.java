package dev.reviewflow.service;

import dev.reviewflow.domain.entity.StepAssignee;

import java.util.List;

/**
 * Treats every assignee id as already resolved. Role ids are matched against
 * the deciding user's id as-is.
 */
public class DirectAssigneeResolver implements AssigneeResolver {

    @Override
    public List<String> resolve(String workspaceId, StepAssignee assignee) {
        return List.of(assignee.getAssigneeId());
    }
}
