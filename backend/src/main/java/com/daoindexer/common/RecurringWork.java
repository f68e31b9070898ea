package com.daoindexer.common;

/**
 * Body of a {@link RecurringTask}. Invocations of one task never overlap.
 */
@FunctionalInterface
public interface RecurringWork {

    void run(TaskContext context) throws Exception;
}
