package dev.reviewflow.service;

import dev.reviewflow.domain.entity.ReviewRequest;
import dev.reviewflow.dto.response.ActivityResponse;
import dev.reviewflow.dto.response.AssignmentResponse;
import dev.reviewflow.dto.response.ChangeRequestResponse;
import dev.reviewflow.dto.response.ReviewResponse;
import dev.reviewflow.exception.NotFoundException;
import dev.reviewflow.repository.ReviewRequestRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/** Read-side service with read-only transactions. */
@Service
@Transactional(readOnly = true)
public class ReviewQueryService {
    private final ReviewRequestRepository repository;

    public ReviewQueryService(ReviewRequestRepository repository) {
        this.repository = repository;
    }

    public ReviewResponse getRequest(String workspaceId, UUID requestId) {
        return ReviewResponse.from(load(workspaceId, requestId));
    }

    public List<ReviewResponse> listReviews(String workspaceId, String knowledgeId) {
        return repository.findByKnowledge(workspaceId, knowledgeId).stream().map(ReviewResponse::from).toList();
    }

    /** All assignments of the request, or only those of {@code stepIndex} when given. */
    public List<AssignmentResponse> listAssignments(String workspaceId, UUID requestId, Integer stepIndex) {
        return load(workspaceId, requestId).getAssignments().stream()
                .filter(a -> stepIndex == null || a.getStepIndex() == stepIndex)
                .map(AssignmentResponse::from)
                .toList();
    }

    public List<ChangeRequestResponse> listChangeRequests(String workspaceId, UUID requestId) {
        return load(workspaceId, requestId).getChangeRequests().stream().map(ChangeRequestResponse::from).toList();
    }

    public List<ActivityResponse> listActivity(String workspaceId, UUID requestId) {
        ReviewRequest request = load(workspaceId, requestId);
        return request.getActivity().stream().map(a -> ActivityResponse.from(request.getId(), a)).toList();
    }

    /** A request of another workspace is reported as not found. */
    private ReviewRequest load(String workspaceId, UUID requestId) {
        return repository.findById(requestId)
                .filter(r -> r.belongsTo(workspaceId))
                .orElseThrow(() -> NotFoundException.reviewRequest(requestId));
    }
}
