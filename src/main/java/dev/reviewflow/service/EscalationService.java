package dev.reviewflow.service;

import dev.reviewflow.domain.valueobject.EscalationTally;
import dev.reviewflow.repository.ReviewRequestRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One bounded sweep over overdue assignments.
 *
 * <p>Not @Transactional as a whole: every request is escalated in its own
 * transaction through {@link ReviewService#escalateOverdueAssignments}, so one
 * failing request (lock timeout, version conflict, emitter outage) never rolls
 * back or stops the others. Escalation never changes a request's status.
 */
@Service
public class EscalationService {
    private static final Logger log = LoggerFactory.getLogger(EscalationService.class);

    private final ReviewRequestRepository repository;
    private final ReviewService reviewService;
    private final Clock clock;
    private final Counter escalatedCounter;
    private final Counter failedCounter;
    private final Timer sweepTimer;

    public EscalationService(ReviewRequestRepository repository, ReviewService reviewService,
                             Clock clock, MeterRegistry meterRegistry) {
        this.repository = repository;
        this.reviewService = reviewService;
        this.clock = clock;
        this.escalatedCounter = Counter.builder("reviewflow.escalations.triggered")
                .description("Assignments escalated after missing their SLA")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("reviewflow.escalations.failed")
                .description("Overdue assignments whose escalation could not be delivered")
                .register(meterRegistry);
        this.sweepTimer = Timer.builder("reviewflow.escalation.sweep")
                .description("Duration of one escalation sweep")
                .register(meterRegistry);
    }

    public int runEscalations() {
        return runEscalations(clock.instant());
    }

    /**
     * @return number of assignments moved from PENDING to ESCALATED by this sweep
     */
    public int runEscalations(Instant now) {
        Timer.Sample sample = Timer.start();
        try {
            List<UUID> candidates = repository.findIdsWithOverdueAssignments(now);
            EscalationTally total = EscalationTally.NONE;
            int failedRequests = 0;
            for (UUID requestId : candidates) {
                try {
                    total = total.plus(reviewService.escalateOverdueAssignments(requestId, now));
                } catch (RuntimeException e) {
                    failedRequests++;
                    log.error("Escalation sweep skipped review {}: {}", requestId, e.getMessage(), e);
                }
            }

            escalatedCounter.increment(total.escalated());
            failedCounter.increment(total.failed());
            if (total.escalated() > 0 || total.failed() > 0 || failedRequests > 0) {
                log.info("Escalation sweep at {}: {} escalated, {} undelivered, {} review(s) skipped of {}",
                        now, total.escalated(), total.failed(), failedRequests, candidates.size());
            } else {
                log.debug("Escalation sweep at {}: nothing overdue", now);
            }
            return total.escalated();
        } finally {
            sample.stop(sweepTimer);
        }
    }
}
