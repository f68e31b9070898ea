package com.daoindexer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * One single-thread executor per recurring task, so runs of the same task never overlap.
 */
@Configuration
public class AsyncConfig {

    public static final String SYNC_EXECUTOR = "sync-executor";
    public static final String CACHE_REBUILD_EXECUTOR = "cache-rebuild-executor";
    public static final String RESYNC_EXECUTOR = "resync-executor";

    @Bean(name = SYNC_EXECUTOR)
    public Executor syncExecutor() {
        return singleThread("sync-");
    }

    @Bean(name = CACHE_REBUILD_EXECUTOR)
    public Executor cacheRebuildExecutor() {
        return singleThread("cache-rebuild-");
    }

    @Bean(name = RESYNC_EXECUTOR)
    public Executor resyncExecutor() {
        return singleThread("resync-");
    }

    private static ThreadPoolTaskExecutor singleThread(String threadNamePrefix) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix(threadNamePrefix);
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }
}
