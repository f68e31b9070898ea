package com.daoindexer.snapshot.config;

import com.daoindexer.common.RecurringTask;
import com.daoindexer.common.TaskNames;
import com.daoindexer.config.AsyncConfig;
import com.daoindexer.config.IndexerProperties;
import com.daoindexer.config.SchedulerConfig;
import com.daoindexer.snapshot.CachedDataRebuildJob;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Cache rebuild task: fixed cadence plus out-of-band runs requested through its {@link com.daoindexer.common.RunTrigger}.
 */
@Configuration
@EnableConfigurationProperties(SnapshotProperties.class)
public class SnapshotTaskConfig {

    @Bean(name = TaskNames.CACHE_REBUILD_TASK)
    public RecurringTask cacheRebuildTask(CachedDataRebuildJob job,
                                          @Qualifier(SchedulerConfig.SCHEDULER_POOL) TaskScheduler scheduler,
                                          @Qualifier(AsyncConfig.CACHE_REBUILD_EXECUTOR) Executor executor,
                                          SnapshotProperties properties,
                                          IndexerProperties indexerProperties) {
        RecurringTask task = new RecurringTask(TaskNames.CACHE_REBUILD_TASK, job, scheduler, executor,
                Duration.ofMillis(properties.getRebuildIntervalMs()),
                Duration.ofMillis(properties.getInitialDelayMs()));
        task.setAutoStartup(indexerProperties.isTasksAutoStartup());
        return task;
    }
}
