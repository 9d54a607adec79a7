package dev.reviewflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reviewflow.escalation")
public record EscalationProperties(boolean schedulerEnabled, String cron) {
    public EscalationProperties { if (cron == null || cron.isBlank()) cron = "0 */15 * * * *"; }
}
