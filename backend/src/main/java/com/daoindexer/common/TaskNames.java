package com.daoindexer.common;

/**
 * Bean names of the {@link RecurringTask}s, usable as qualifiers for their {@link RunTrigger}.
 */
public final class TaskNames {

    public static final String SYNC_TASK = "syncTask";
    public static final String CACHE_REBUILD_TASK = "cacheRebuildTask";
    public static final String FORCE_RESYNC_TASK = "forceResyncTask";

    private TaskNames() {
    }
}
