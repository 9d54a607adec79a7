package dev.reviewflow.controller;

import dev.reviewflow.access.AccessGuard;
import dev.reviewflow.access.GuardedAction;
import dev.reviewflow.dto.request.ChangeRequestRequest;
import dev.reviewflow.dto.request.DecisionRequest;
import dev.reviewflow.dto.request.StartReviewRequest;
import dev.reviewflow.dto.response.ActivityResponse;
import dev.reviewflow.dto.response.AssignmentResponse;
import dev.reviewflow.dto.response.ChangeRequestResponse;
import dev.reviewflow.dto.response.DecisionResponse;
import dev.reviewflow.dto.response.ReviewResponse;
import dev.reviewflow.service.ReviewQueryService;
import dev.reviewflow.service.ReviewService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;
import java.util.UUID;

/**
 * Review lifecycle endpoints. The caller's identity comes from the gateway
 * headers; the acting user is always the header user, never a body field.
 */
@RestController
@RequestMapping("/reviews")
public class ReviewController {
    private final ReviewService reviewService;
    private final ReviewQueryService queryService;
    private final AccessGuard accessGuard;

    public ReviewController(ReviewService reviewService, ReviewQueryService queryService, AccessGuard accessGuard) {
        this.reviewService = reviewService;
        this.queryService = queryService;
        this.accessGuard = accessGuard;
    }

    @PostMapping
    public ResponseEntity<ReviewResponse> startReview(@RequestHeader(ApiHeaders.USER_ID) String userId,
                                                      @RequestHeader(ApiHeaders.WORKSPACE_ID) String workspaceId,
                                                      @RequestBody StartReviewRequest body) {
        accessGuard.check(userId, workspaceId, GuardedAction.REVIEW_START, body.knowledgeId());
        ReviewResponse started = ReviewResponse.from(
                reviewService.startReview(workspaceId, body.knowledgeId(), body.workflowId(), userId));
        return ResponseEntity.status(HttpStatus.CREATED)
                .location(URI.create("/reviews/" + started.id()))
                .body(started);
    }

    @GetMapping("/{id}")
    public ReviewResponse getReview(@RequestHeader(ApiHeaders.USER_ID) String userId,
                                    @RequestHeader(ApiHeaders.WORKSPACE_ID) String workspaceId,
                                    @PathVariable UUID id) {
        accessGuard.check(userId, workspaceId, GuardedAction.REVIEW_READ, id.toString());
        return queryService.getRequest(workspaceId, id);
    }

    @GetMapping
    public List<ReviewResponse> listReviews(@RequestHeader(ApiHeaders.USER_ID) String userId,
                                            @RequestHeader(ApiHeaders.WORKSPACE_ID) String workspaceId,
                                            @RequestParam String knowledgeId) {
        accessGuard.check(userId, workspaceId, GuardedAction.REVIEW_READ, knowledgeId);
        return queryService.listReviews(workspaceId, knowledgeId);
    }

    @GetMapping("/{id}/assignments")
    public List<AssignmentResponse> listAssignments(@RequestHeader(ApiHeaders.USER_ID) String userId,
                                                    @RequestHeader(ApiHeaders.WORKSPACE_ID) String workspaceId,
                                                    @PathVariable UUID id,
                                                    @RequestParam(name = "step", required = false) Integer step) {
        accessGuard.check(userId, workspaceId, GuardedAction.REVIEW_READ, id.toString());
        return queryService.listAssignments(workspaceId, id, step);
    }

    @PostMapping("/{id}/decisions")
    public DecisionResponse recordDecision(@RequestHeader(ApiHeaders.USER_ID) String userId,
                                           @RequestHeader(ApiHeaders.WORKSPACE_ID) String workspaceId,
                                           @PathVariable UUID id,
                                           @RequestBody DecisionRequest body) {
        accessGuard.check(userId, workspaceId, GuardedAction.REVIEW_DECIDE, id.toString());
        return DecisionResponse.from(reviewService.recordDecision(workspaceId, id, userId, body.toDecision()));
    }

    @PostMapping("/{id}/change-requests")
    public ResponseEntity<ChangeRequestResponse> requestChanges(@RequestHeader(ApiHeaders.USER_ID) String userId,
                                                                @RequestHeader(ApiHeaders.WORKSPACE_ID) String workspaceId,
                                                                @PathVariable UUID id,
                                                                @RequestBody ChangeRequestRequest body) {
        accessGuard.check(userId, workspaceId, GuardedAction.REVIEW_REQUEST_CHANGES, id.toString());
        ChangeRequestResponse created = ChangeRequestResponse.from(
                reviewService.requestChanges(workspaceId, id, body.toDetails(), userId));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}/change-requests")
    public List<ChangeRequestResponse> listChangeRequests(@RequestHeader(ApiHeaders.USER_ID) String userId,
                                                          @RequestHeader(ApiHeaders.WORKSPACE_ID) String workspaceId,
                                                          @PathVariable UUID id) {
        accessGuard.check(userId, workspaceId, GuardedAction.REVIEW_READ, id.toString());
        return queryService.listChangeRequests(workspaceId, id);
    }

    @PostMapping("/{id}/reopen")
    public ReviewResponse reopen(@RequestHeader(ApiHeaders.USER_ID) String userId,
                                 @RequestHeader(ApiHeaders.WORKSPACE_ID) String workspaceId,
                                 @PathVariable UUID id) {
        accessGuard.check(userId, workspaceId, GuardedAction.REVIEW_REOPEN, id.toString());
        return ReviewResponse.from(reviewService.reopen(workspaceId, id, userId));
    }

    @GetMapping("/{id}/activity")
    public List<ActivityResponse> listActivity(@RequestHeader(ApiHeaders.USER_ID) String userId,
                                               @RequestHeader(ApiHeaders.WORKSPACE_ID) String workspaceId,
                                               @PathVariable UUID id) {
        accessGuard.check(userId, workspaceId, GuardedAction.REVIEW_READ, id.toString());
        return queryService.listActivity(workspaceId, id);
    }
}
