package dev.reviewflow.controller;

import dev.reviewflow.access.AccessGuard;
import dev.reviewflow.access.GuardedAction;
import dev.reviewflow.dto.response.EscalationResponse;
import dev.reviewflow.service.EscalationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;

/**
 * Manual trigger for the escalation sweep, for operators and external schedulers.
 * {@code now} overrides the sweep time; omitted, the server clock is used.
 */
@RestController
@RequestMapping("/escalations")
public class EscalationController {
    private static final Logger log = LoggerFactory.getLogger(EscalationController.class);
    private final EscalationService escalationService;
    private final AccessGuard accessGuard;
    private final Clock clock;

    public EscalationController(EscalationService escalationService, AccessGuard accessGuard, Clock clock) {
        this.escalationService = escalationService;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    @PostMapping
    public EscalationResponse runEscalations(@RequestHeader(ApiHeaders.USER_ID) String userId,
                                             @RequestHeader(ApiHeaders.WORKSPACE_ID) String workspaceId,
                                             @RequestParam(required = false) Instant now) {
        accessGuard.check(userId, workspaceId, GuardedAction.ESCALATION_RUN, null);
        Instant sweptAt = now != null ? now : clock.instant();
        log.info("Escalation sweep triggered by {} at {}", userId, sweptAt);
        return new EscalationResponse(escalationService.runEscalations(sweptAt), sweptAt);
    }
}
