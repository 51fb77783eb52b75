package com.expirebot.expiry.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Single-thread scheduler for the expiry sweep. Shutdown interrupts a running pass instead of
 * waiting for it, which is how the sweep gets cancelled.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String SWEEP_SCHEDULER = "sweep-scheduler";

    @Bean(name = SWEEP_SCHEDULER)
    public ThreadPoolTaskScheduler sweepScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("sweep-");
        s.setWaitForTasksToCompleteOnShutdown(false);
        return s;
    }
}
