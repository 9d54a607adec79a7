package dev.reviewflow.controller;

import dev.reviewflow.access.AccessGuard;
import dev.reviewflow.access.GuardedAction;
import dev.reviewflow.domain.entity.StepAssignee;
import dev.reviewflow.domain.entity.Workflow;
import dev.reviewflow.domain.entity.WorkflowStep;
import dev.reviewflow.domain.enums.StepType;
import dev.reviewflow.exception.AccessDeniedException;
import dev.reviewflow.exception.NotFoundException;
import dev.reviewflow.exception.WorkflowValidationException;
import dev.reviewflow.exception.WorkflowValidationException.Violation;
import dev.reviewflow.service.WorkflowService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(WorkflowController.class)
@AutoConfigureMockMvc(addFilters = false)
class WorkflowControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @MockitoBean
  private WorkflowService workflowService;

  @MockitoBean
  private AccessGuard accessGuard;

  @Nested
  @DisplayName("POST /workflows")
  class CreateWorkflow {

    @Test
    @DisplayName("should create the workflow in the caller's workspace and return 201")
    void shouldCreate() throws Exception {
      Workflow workflow = sampleWorkflow();
      when(workflowService.createWorkflow(eq("ws-1"), eq("Doc review"), anyList(), isNull()))
          .thenReturn(workflow);

      mockMvc.perform(post("/workflows")
          .contentType(MediaType.APPLICATION_JSON)
          .header(ApiHeaders.USER_ID, "admin")
          .header(ApiHeaders.WORKSPACE_ID, "ws-1")
          .content(createBody()))
          .andExpect(status().isCreated())
          .andExpect(header().string("Location", "/workflows/" + workflow.getId()))
          .andExpect(jsonPath("$.id").value(workflow.getId().toString()))
          .andExpect(jsonPath("$.steps[0].type").value("SINGLE_APPROVAL"))
          .andExpect(jsonPath("$.steps[0].assignees[0].assigneeId").value("alice"))
          .andExpect(jsonPath("$.steps[0].slaHours").value(24.0));

      verify(accessGuard).check("admin", "ws-1", GuardedAction.WORKFLOW_MANAGE, null);
    }

    @Test
    @DisplayName("should return 400 with every violation")
    void shouldReportViolations() throws Exception {
      when(workflowService.createWorkflow(any(), any(), any(), any()))
          .thenThrow(new WorkflowValidationException(List.of(
              new Violation("name", "must not be blank"),
              new Violation("steps[0].assignees", "at least one assignee is required"))));

      mockMvc.perform(post("/workflows")
          .contentType(MediaType.APPLICATION_JSON)
          .header(ApiHeaders.USER_ID, "admin")
          .header(ApiHeaders.WORKSPACE_ID, "ws-1")
          .content(createBody()))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.type").value("https://reviewflow.dev/errors/invalid-workflow"))
          .andExpect(jsonPath("$.violations.length()").value(2))
          .andExpect(jsonPath("$.violations[1].field").value("steps[0].assignees"));
    }

    @Test
    @DisplayName("should return 403 when the guard denies")
    void shouldDeny() throws Exception {
      doThrow(new AccessDeniedException("intruder", "ws-1", GuardedAction.WORKFLOW_MANAGE))
          .when(accessGuard).check(eq("intruder"), eq("ws-1"), eq(GuardedAction.WORKFLOW_MANAGE), any());

      mockMvc.perform(post("/workflows")
          .contentType(MediaType.APPLICATION_JSON)
          .header(ApiHeaders.USER_ID, "intruder")
          .header(ApiHeaders.WORKSPACE_ID, "ws-1")
          .content(createBody()))
          .andExpect(status().isForbidden())
          .andExpect(jsonPath("$.title").value("Access Denied"));

      verifyNoInteractions(workflowService);
    }

    @Test
    @DisplayName("should return 400 when the identity headers are missing")
    void shouldRequireHeaders() throws Exception {
      mockMvc.perform(post("/workflows")
          .contentType(MediaType.APPLICATION_JSON)
          .content(createBody()))
          .andExpect(status().isBadRequest());

      verifyNoInteractions(workflowService);
    }
  }

  @Nested
  @DisplayName("GET /workflows")
  class ReadWorkflows {

    @Test
    @DisplayName("should list the workspace's workflows")
    void shouldList() throws Exception {
      when(workflowService.listWorkflows("ws-1")).thenReturn(List.of(sampleWorkflow()));

      mockMvc.perform(get("/workflows")
          .header(ApiHeaders.USER_ID, "reader")
          .header(ApiHeaders.WORKSPACE_ID, "ws-1"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$[0].name").value("Doc review"));
    }

    @Test
    @DisplayName("should return 404 for an unknown workflow")
    void shouldReturnNotFound() throws Exception {
      UUID id = UUID.randomUUID();
      when(workflowService.getWorkflow("ws-1", id)).thenThrow(NotFoundException.workflow(id));

      mockMvc.perform(get("/workflows/{id}", id)
          .header(ApiHeaders.USER_ID, "reader")
          .header(ApiHeaders.WORKSPACE_ID, "ws-1"))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.type").value("https://reviewflow.dev/errors/not-found"));
    }
  }

  // ── Test Fixtures ──

  private static Workflow sampleWorkflow() {
    return Workflow.create("ws-1", "Doc review", null, List.of(
        WorkflowStep.create(0, StepType.SINGLE_APPROVAL, "peer", 24.0, 1, List.of(StepAssignee.user("alice")))),
        Instant.parse("2025-03-01T09:00:00Z"));
  }

  private static String createBody() {
    return """
        {
          "name": "Doc review",
          "steps": [
            {
              "index": 0,
              "type": "SINGLE_APPROVAL",
              "name": "peer",
              "slaHours": 24,
              "assignees": [{"assigneeType": "USER", "assigneeId": "alice"}]
            }
          ]
        }
        """;
  }
}
