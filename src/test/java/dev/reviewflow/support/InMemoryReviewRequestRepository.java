package dev.reviewflow.support;

import dev.reviewflow.domain.entity.ReviewRequest;
import dev.reviewflow.domain.enums.ReviewStatus;
import dev.reviewflow.repository.ReviewRequestRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Keeps aggregates by reference; counts saves so tests can assert nothing was written. */
public class InMemoryReviewRequestRepository implements ReviewRequestRepository {
    private final Map<UUID, ReviewRequest> store = new ConcurrentHashMap<>();
    private final AtomicInteger saves = new AtomicInteger();

    @Override
    public ReviewRequest save(ReviewRequest request) {
        saves.incrementAndGet();
        store.put(request.getId(), request);
        return request;
    }

    @Override
    public Optional<ReviewRequest> findById(UUID id) {
        return Optional.ofNullable(store.get(id));
    }

    @Override
    public Optional<ReviewRequest> findByIdForUpdate(UUID id) {
        return findById(id);
    }

    @Override
    public List<ReviewRequest> findByKnowledge(String workspaceId, String knowledgeId) {
        return store.values().stream()
                .filter(r -> r.getWorkspaceId().equals(workspaceId) && r.getKnowledgeId().equals(knowledgeId))
                .sorted(Comparator.comparing(ReviewRequest::getCreatedAt).reversed())
                .toList();
    }

    @Override
    public List<UUID> findIdsWithOverdueAssignments(Instant now) {
        return store.values().stream()
                .filter(r -> r.getStatus() == ReviewStatus.IN_PROGRESS)
                .filter(r -> !r.overdueAssignments(now).isEmpty())
                .map(ReviewRequest::getId)
                .toList();
    }

    public int saveCount() {
        return saves.get();
    }
}
