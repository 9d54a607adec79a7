package dev.reviewflow.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StartReviewRequest(String knowledgeId, UUID workflowId) {
    public StartReviewRequest {
        if (workflowId == null) throw new IllegalArgumentException("workflowId required");
    }
}
