package com.daoindexer.common;

import java.time.Duration;

/**
 * View of the running {@link RecurringTask} handed to its work on every invocation.
 */
public interface TaskContext {

    Duration getInterval();

    /** Delay until the next regular run, counted from the end of the current one. */
    void setInterval(Duration interval);

    /** True once the owning task is stopping (application shutdown). */
    boolean isCancellationRequested();
}
