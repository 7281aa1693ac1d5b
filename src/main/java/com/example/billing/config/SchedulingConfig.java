package com.example.billing.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Enables the recurring invoice sweep. Set {@code billing.recurring.enabled=false}
 * on every node but one when running several instances against the same database.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "billing.recurring.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        // One thread: a sweep never overlaps the previous one
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("billing-scheduler-");
        scheduler.initialize();
        return scheduler;
    }
}
