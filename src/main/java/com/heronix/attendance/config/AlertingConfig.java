package com.heronix.attendance.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import lombok.extern.slf4j.Slf4j;

/**
 * Infrastructure beans for the alerting pipeline.
 */
@Slf4j
@Configuration
public class AlertingConfig {

    /**
     * Clock used to derive "today" for trailing reporting windows.
     */
    @Bean
    public Clock attendanceClock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Bounded pool for per-student evaluation when
     * {@code heronix.attendance.alerts.parallel-threads} is greater than one.
     */
    @Bean(name = "alertEvaluationExecutor")
    public ThreadPoolTaskExecutor alertEvaluationExecutor(AttendanceProperties properties) {
        int threads = Math.max(1, properties.getAlerts().getParallelThreads());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("alert-eval-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();

        log.info("Alert evaluation executor initialized with {} thread(s)", threads);
        return executor;
    }
}
