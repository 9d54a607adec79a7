package dev.reviewflow.service;

import dev.reviewflow.domain.entity.StepAssignee;
import dev.reviewflow.domain.entity.Workflow;
import dev.reviewflow.domain.entity.WorkflowStep;
import dev.reviewflow.domain.enums.StepType;
import dev.reviewflow.domain.valueobject.StepDefinition;
import dev.reviewflow.domain.valueobject.StepDefinition.AssigneeDefinition;
import dev.reviewflow.exception.NotFoundException;
import dev.reviewflow.exception.WorkflowValidationException;
import dev.reviewflow.exception.WorkflowValidationException.Violation;
import dev.reviewflow.support.InMemoryWorkflowRepository;
import dev.reviewflow.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class WorkflowServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T09:00:00Z");

    private InMemoryWorkflowRepository repository;
    private MutableClock clock;
    private WorkflowService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryWorkflowRepository();
        clock = new MutableClock(NOW);
        service = new WorkflowService(repository, clock);
    }

    @Nested
    @DisplayName("createWorkflow")
    class CreateWorkflow {

        @Test
        @DisplayName("stores steps ordered by index with trimmed names")
        void storesSteps() {
            Workflow wf = service.createWorkflow("ws-1", "  Legal sign-off ", List.of(
                    new StepDefinition(1, StepType.ALL_APPROVAL, "legal", null,
                            List.of(AssigneeDefinition.role("legal-team"))),
                    new StepDefinition(0, StepType.SINGLE_APPROVAL, " peer ", 4.0,
                            List.of(AssigneeDefinition.user(" alice "), AssigneeDefinition.user("bob")))),
                    "Two-stage review");

            assertThat(wf.getName()).isEqualTo("Legal sign-off");
            assertThat(wf.getDescription()).isEqualTo("Two-stage review");
            assertThat(wf.getCreatedAt()).isEqualTo(NOW);
            assertThat(wf.getSteps()).extracting(WorkflowStep::getStepIndex, WorkflowStep::getName)
                    .containsExactly(tuple(0, "peer"), tuple(1, "legal"));
            assertThat(wf.step(0)).get().satisfies(step -> {
                assertThat(step.sla()).contains(Duration.ofHours(4));
                assertThat(step.getAssignees()).containsExactly(StepAssignee.user("alice"), StepAssignee.user("bob"));
            });
            assertThat(wf.isLastStep(1)).isTrue();
            assertThat(repository.findById(wf.getId())).isPresent();
        }

        @Test
        @DisplayName("reports every violation at once")
        void collectsViolations() {
            List<StepDefinition> steps = Arrays.asList(
                    new StepDefinition(0, null, " ", -1.0, List.of()),
                    new StepDefinition(0, StepType.SINGLE_APPROVAL, "dup", null,
                            List.of(new AssigneeDefinition(null, ""))));

            assertThatThrownBy(() -> service.createWorkflow("ws-1", "", steps, null))
                    .isInstanceOfSatisfying(WorkflowValidationException.class, e ->
                            assertThat(e.getViolations()).extracting(Violation::field).containsExactly(
                                    "name",
                                    "steps[0].type",
                                    "steps[0].name",
                                    "steps[0].slaHours",
                                    "steps[0].assignees",
                                    "steps[1].index",
                                    "steps[1].assignees[0].assigneeType",
                                    "steps[1].assignees[0].assigneeId",
                                    "steps"));
            assertThat(repository.findByWorkspaceId("ws-1")).isEmpty();
        }

        @Test
        @DisplayName("requires at least one step")
        void requiresSteps() {
            assertThatThrownBy(() -> service.createWorkflow("ws-1", "Empty", List.of(), null))
                    .isInstanceOfSatisfying(WorkflowValidationException.class, e ->
                            assertThat(e.getViolations()).containsExactly(
                                    new Violation("steps", "at least one step is required")));
        }

        @Test
        @DisplayName("rejects gaps in step indices")
        void rejectsGaps() {
            List<StepDefinition> steps = List.of(
                    new StepDefinition(0, StepType.SINGLE_APPROVAL, "a", null, List.of(AssigneeDefinition.user("u"))),
                    new StepDefinition(2, StepType.SINGLE_APPROVAL, "b", null, List.of(AssigneeDefinition.user("u"))));

            assertThatThrownBy(() -> service.createWorkflow("ws-1", "Gappy", steps, null))
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessageContaining("contiguous");
        }

        @Test
        @DisplayName("rejects non-finite SLA hours")
        void rejectsInfiniteSla() {
            List<StepDefinition> steps = List.of(new StepDefinition(0, StepType.SINGLE_APPROVAL, "a",
                    Double.POSITIVE_INFINITY, List.of(AssigneeDefinition.user("u"))));

            assertThatThrownBy(() -> service.createWorkflow("ws-1", "Forever", steps, null))
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessageContaining("steps[0].slaHours");
        }

        @Test
        @DisplayName("rejects names and assignee ids longer than their columns")
        void rejectsOversizedText() {
            List<StepDefinition> steps = List.of(new StepDefinition(0, StepType.SINGLE_APPROVAL, "n".repeat(201),
                    null, List.of(AssigneeDefinition.user("u".repeat(129)))));

            assertThatThrownBy(() -> service.createWorkflow("ws-1", "w".repeat(201), steps, "d".repeat(2001)))
                    .isInstanceOfSatisfying(WorkflowValidationException.class, e ->
                            assertThat(e.getViolations()).extracting(Violation::field).containsExactly(
                                    "name",
                                    "steps[0].name",
                                    "steps[0].assignees[0].assigneeId",
                                    "description"));
            assertThat(repository.findByWorkspaceId("ws-1")).isEmpty();
        }

        @Test
        @DisplayName("stores the approval threshold of a MULTI_APPROVAL step")
        void storesThreshold() {
            Workflow wf = service.createWorkflow("ws-1", "Quorum", List.of(new StepDefinition(0,
                    StepType.MULTI_APPROVAL, "editors", null,
                    List.of(AssigneeDefinition.user("a"), AssigneeDefinition.user("b"), AssigneeDefinition.user("c")),
                    2)), null);

            assertThat(wf.step(0)).get().extracting(WorkflowStep::getRequiredApprovals).isEqualTo(2);
        }

        @Test
        @DisplayName("rejects thresholds outside 1..assignees and thresholds on other policies")
        void rejectsBadThreshold() {
            List<AssigneeDefinition> two = List.of(AssigneeDefinition.user("a"), AssigneeDefinition.user("b"));
            List<StepDefinition> steps = List.of(
                    new StepDefinition(0, StepType.MULTI_APPROVAL, "too many", null, two, 3),
                    new StepDefinition(1, StepType.MULTI_APPROVAL, "zero", null, two, 0),
                    new StepDefinition(2, StepType.SINGLE_APPROVAL, "single", null, two, 2));

            assertThatThrownBy(() -> service.createWorkflow("ws-1", "Bad quorum", steps, null))
                    .isInstanceOfSatisfying(WorkflowValidationException.class, e ->
                            assertThat(e.getViolations()).extracting(Violation::field).containsExactly(
                                    "steps[0].requiredApprovals",
                                    "steps[1].requiredApprovals",
                                    "steps[2].requiredApprovals"));
        }
    }

    @Test
    @DisplayName("getWorkflow fails with NotFound for an unknown id")
    void unknownWorkflow() {
        assertThatThrownBy(() -> service.getWorkflow("ws-1", UUID.randomUUID()))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("getWorkflow treats a workflow of another workspace as not found")
    void foreignWorkflow() {
        Workflow wf = service.createWorkflow("ws-1", "Mine", List.of(new StepDefinition(0,
                StepType.SINGLE_APPROVAL, "a", null, List.of(AssigneeDefinition.user("u")))), null);

        assertThat(service.getWorkflow("ws-1", wf.getId())).isSameAs(wf);
        assertThatThrownBy(() -> service.getWorkflow("ws-2", wf.getId()))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("listWorkflows returns only the workspace's workflows, oldest first")
    void listsByWorkspace() {
        List<StepDefinition> steps = List.of(new StepDefinition(0, StepType.SINGLE_APPROVAL, "a", null,
                List.of(AssigneeDefinition.user("u"))));
        Workflow first = service.createWorkflow("ws-1", "First", steps, null);
        clock.advance(Duration.ofMinutes(1));
        Workflow second = service.createWorkflow("ws-1", "Second", steps, null);
        service.createWorkflow("ws-2", "Elsewhere", steps, null);

        assertThat(service.listWorkflows("ws-1")).extracting(Workflow::getId)
                .containsExactly(first.getId(), second.getId());
    }
}
