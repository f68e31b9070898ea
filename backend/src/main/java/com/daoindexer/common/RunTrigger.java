package com.daoindexer.common;

/**
 * Out-of-band "run now" signal for a recurring task.
 */
@FunctionalInterface
public interface RunTrigger {

    /**
     * Requests an immediate run. Absorbed when a run is already pending.
     *
     * @return true if a new run was queued, false if the request collapsed into a pending one
     */
    boolean tryRunImmediately();
}
