package dev.reviewflow.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the escalation scheduler. Overridable defaults live in
 * {@link ReviewFlowDefaultsAutoConfiguration}.
 */
@Configuration
@EnableScheduling
public class ReviewFlowConfig {
}
