package dev.reviewflow.config;

import dev.reviewflow.access.AccessGuard;
import dev.reviewflow.access.AllowAllAccessGuard;
import dev.reviewflow.service.AssigneeResolver;
import dev.reviewflow.service.DirectAssigneeResolver;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Default engine collaborators. Registered as an auto-configuration so it is
 * processed after the application's own configuration; each default backs off
 * when a deployment defines a bean of the same type.
 */
@AutoConfiguration
public class ReviewFlowDefaultsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessGuard accessGuard() {
        return new AllowAllAccessGuard();
    }

    @Bean
    @ConditionalOnMissingBean
    public AssigneeResolver assigneeResolver() {
        return new DirectAssigneeResolver();
    }
}
