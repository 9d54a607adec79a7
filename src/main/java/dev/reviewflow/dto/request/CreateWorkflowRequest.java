package dev.reviewflow.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.reviewflow.domain.valueobject.StepDefinition;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateWorkflowRequest(String name, String description, List<StepDefinition> steps) {}
