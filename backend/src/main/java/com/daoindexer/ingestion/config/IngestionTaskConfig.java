package com.daoindexer.ingestion.config;

import com.daoindexer.common.RecurringTask;
import com.daoindexer.common.TaskNames;
import com.daoindexer.config.AsyncConfig;
import com.daoindexer.config.IndexerProperties;
import com.daoindexer.config.SchedulerConfig;
import com.daoindexer.ingestion.job.ForceResyncJob;
import com.daoindexer.ingestion.job.SyncQueueJob;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Recurring tasks of the ingestion side: queue drain and force-resync.
 */
@Configuration
public class IngestionTaskConfig {

    @Bean(name = TaskNames.SYNC_TASK)
    public RecurringTask syncTask(SyncQueueJob job,
                                  @Qualifier(SchedulerConfig.SCHEDULER_POOL) TaskScheduler scheduler,
                                  @Qualifier(AsyncConfig.SYNC_EXECUTOR) Executor executor,
                                  SyncProperties properties,
                                  IndexerProperties indexerProperties) {
        RecurringTask task = new RecurringTask(TaskNames.SYNC_TASK, job, scheduler, executor,
                properties.interval(),
                Duration.ofMillis(properties.getInitialDelayMs()));
        task.setAutoStartup(indexerProperties.isTasksAutoStartup());
        return task;
    }

    @Bean(name = TaskNames.FORCE_RESYNC_TASK)
    public RecurringTask forceResyncTask(ForceResyncJob job,
                                         @Qualifier(SchedulerConfig.SCHEDULER_POOL) TaskScheduler scheduler,
                                         @Qualifier(AsyncConfig.RESYNC_EXECUTOR) Executor executor,
                                         ResyncProperties properties,
                                         IndexerProperties indexerProperties) {
        RecurringTask task = new RecurringTask(TaskNames.FORCE_RESYNC_TASK, job, scheduler, executor,
                Duration.ofMillis(properties.getCheckIntervalMs()),
                Duration.ofMillis(properties.getInitialDelayMs()));
        task.setAutoStartup(indexerProperties.isTasksAutoStartup());
        return task;
    }
}
