package dev.reviewflow.controller;

import dev.reviewflow.access.AccessGuard;
import dev.reviewflow.access.GuardedAction;
import dev.reviewflow.dto.request.CreateWorkflowRequest;
import dev.reviewflow.dto.response.WorkflowResponse;
import dev.reviewflow.service.WorkflowService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/workflows")
public class WorkflowController {
    private final WorkflowService workflowService;
    private final AccessGuard accessGuard;

    public WorkflowController(WorkflowService workflowService, AccessGuard accessGuard) {
        this.workflowService = workflowService;
        this.accessGuard = accessGuard;
    }

    @PostMapping
    public ResponseEntity<WorkflowResponse> createWorkflow(@RequestHeader(ApiHeaders.USER_ID) String userId,
                                                           @RequestHeader(ApiHeaders.WORKSPACE_ID) String workspaceId,
                                                           @RequestBody CreateWorkflowRequest body) {
        accessGuard.check(userId, workspaceId, GuardedAction.WORKFLOW_MANAGE, null);
        WorkflowResponse created = WorkflowResponse.from(
                workflowService.createWorkflow(workspaceId, body.name(), body.steps(), body.description()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .location(URI.create("/workflows/" + created.id()))
                .body(created);
    }

    @GetMapping
    public List<WorkflowResponse> listWorkflows(@RequestHeader(ApiHeaders.USER_ID) String userId,
                                                @RequestHeader(ApiHeaders.WORKSPACE_ID) String workspaceId) {
        accessGuard.check(userId, workspaceId, GuardedAction.WORKFLOW_READ, null);
        return workflowService.listWorkflows(workspaceId).stream().map(WorkflowResponse::from).toList();
    }

    @GetMapping("/{id}")
    public WorkflowResponse getWorkflow(@RequestHeader(ApiHeaders.USER_ID) String userId,
                                        @RequestHeader(ApiHeaders.WORKSPACE_ID) String workspaceId,
                                        @PathVariable UUID id) {
        accessGuard.check(userId, workspaceId, GuardedAction.WORKFLOW_READ, id.toString());
        return WorkflowResponse.from(workflowService.getWorkflow(workspaceId, id));
    }
}
