package com.walletwatch.config;

import com.walletwatch.tracking.config.TrackingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler pool for @Scheduled jobs (TrackingPollJob). Shutdown waits for a running sweep to finish its current
 * transaction commit.
 */
@Configuration
@EnableScheduling
@Slf4j
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool(TrackingProperties trackingProperties) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setThreadNamePrefix("scheduler-");
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(Math.max(0, trackingProperties.getShutdownAwaitSeconds()));
        s.setErrorHandler(t -> log.error("Unhandled error in scheduled task", t));
        s.initialize();
        return s;
    }
}
