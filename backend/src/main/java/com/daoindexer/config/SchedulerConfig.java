package com.daoindexer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Timer pool shared by the recurring tasks. Timer callbacks only hand a run to the task's own executor,
 * so one thread per task is plenty.
 */
@Configuration
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    private static final int RECURRING_TASKS = 3;

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(RECURRING_TASKS);
        s.setThreadNamePrefix("task-timer-");
        // ticks are re-armed after every run; drop the cancelled ones from the queue
        s.setRemoveOnCancelPolicy(true);
        s.initialize();
        return s;
    }
}
