package dev.reviewflow.service;

import dev.reviewflow.config.EscalationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-process trigger for the escalation sweep. Off by default; deployments that
 * call {@code POST /escalations} from an external cron leave it disabled.
 */
@Component
@ConditionalOnProperty(prefix = "reviewflow.escalation", name = "scheduler-enabled", havingValue = "true")
public class EscalationScheduler {
    private static final Logger log = LoggerFactory.getLogger(EscalationScheduler.class);
    private final EscalationService escalationService;

    public EscalationScheduler(EscalationService escalationService, EscalationProperties properties) {
        this.escalationService = escalationService;
        log.info("Escalation scheduler enabled, cron='{}'", properties.cron());
    }

    @Scheduled(cron = "${reviewflow.escalation.cron:0 */15 * * * *}", zone = "UTC")
    public void sweep() {
        try {
            escalationService.runEscalations();
        } catch (RuntimeException e) {
            // next tick retries
            log.error("Scheduled escalation sweep failed: {}", e.getMessage(), e);
        }
    }
}
