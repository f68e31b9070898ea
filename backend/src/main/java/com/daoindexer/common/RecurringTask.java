package com.daoindexer.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic task whose interval may be changed by its own work between runs.
 *
 * <p>Runs are executed on a dedicated single-thread executor, so two invocations of the same task never
 * overlap. At most one run is pending at any time: a timer tick or {@link #tryRunImmediately()} arriving
 * while a run is already pending is absorbed, and one arriving while a run is in flight yields exactly
 * one subsequent run. The next regular run is armed after each run completes, using the interval current
 * at that moment.
 *
 * <p>Started and stopped with the Spring context; a failing run is logged and the timer is re-armed.
 */
@Slf4j
public class RecurringTask implements RunTrigger, TaskContext, SmartLifecycle {

    private final String name;
    private final RecurringWork work;
    private final TaskScheduler scheduler;
    private final Executor worker;
    private final Duration initialDelay;

    private final AtomicBoolean pending = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Object timerLock = new Object();

    private volatile Duration interval;
    private volatile boolean stopping;
    private boolean autoStartup = true;
    private ScheduledFuture<?> nextTick;

    public RecurringTask(String name, RecurringWork work, TaskScheduler scheduler, Executor worker,
                         Duration interval, Duration initialDelay) {
        this.name = Objects.requireNonNull(name, "name");
        this.work = Objects.requireNonNull(work, "work");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.worker = Objects.requireNonNull(worker, "worker");
        this.initialDelay = initialDelay != null ? initialDelay : Duration.ZERO;
        setInterval(interval);
    }

    public String getName() {
        return name;
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public void setInterval(Duration interval) {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be non-negative: " + interval);
        }
        this.interval = interval;
    }

    @Override
    public boolean isCancellationRequested() {
        return stopping;
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        stopping = false;
        armTimer(initialDelay);
        log.info("Task {} started: first run in {}, interval {}", name, initialDelay, interval);
    }

    @Override
    public void stop() {
        stopping = true;
        started.set(false);
        synchronized (timerLock) {
            if (nextTick != null) {
                nextTick.cancel(false);
                nextTick = null;
            }
        }
        log.info("Task {} stopped", name);
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public boolean tryRunImmediately() {
        if (stopping) {
            return false;
        }
        return submit();
    }

    private boolean submit() {
        if (!pending.compareAndSet(false, true)) {
            log.trace("Task {} already has a pending run", name);
            return false;
        }
        try {
            worker.execute(this::runOnce);
            return true;
        } catch (RejectedExecutionException e) {
            pending.set(false);
            log.warn("Task {} run rejected by executor: {}", name, e.getMessage());
            return false;
        }
    }

    void runOnce() {
        pending.set(false);
        if (stopping) {
            return;
        }
        long startNanos = System.nanoTime();
        try {
            work.run(this);
            log.trace("Task {} run finished in {} ms", name, (System.nanoTime() - startNanos) / 1_000_000L);
        } catch (Exception e) {
            log.error("Task {} run failed, next run in {}", name, interval, e);
        } finally {
            if (!stopping) {
                armTimer(interval);
            }
        }
    }

    private void armTimer(Duration delay) {
        synchronized (timerLock) {
            if (nextTick != null) {
                nextTick.cancel(false);
            }
            nextTick = scheduler.schedule(this::submit, Instant.now().plus(delay));
        }
    }
}
