package dev.reviewflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reviewflow.notifications")
public record NotificationProperties(String queue) {
    public NotificationProperties { if (queue == null || queue.isBlank()) queue = "reviewflow-notifications"; }
}
