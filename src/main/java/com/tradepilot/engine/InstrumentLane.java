package com.tradepilot.engine;

import java.time.Duration;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serial executor for one instrument on top of the shared worker pool.
 *
 * <p>Tasks run one at a time in submission order. At most one task of this lane is on
 * the pool at any moment; after each task the lane re-queues itself if more work is
 * waiting, so busy instruments cannot starve the others.
 *
 * <p>A task that throws is logged and the lane moves on.
 */
public class InstrumentLane {

    private static final Logger log = LoggerFactory.getLogger(InstrumentLane.class);

    private final String instrumentId;
    private final Executor executor;

    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object idleMonitor = new Object();

    public InstrumentLane(String instrumentId, Executor executor) {
        this.instrumentId = instrumentId;
        this.executor = executor;
    }

    /**
     * Queues a task.
     *
     * @return false if the lane is closed and the task was not accepted
     */
    public boolean submit(Runnable task) {
        if (closed.get()) {
            return false;
        }
        tasks.add(task);
        scheduleIfIdle();
        return true;
    }

    /**
     * Refuses further tasks and drops the queued ones. The task currently running, if
     * any, is left to finish.
     *
     * @return the number of queued tasks dropped
     */
    public int close() {
        closed.set(true);
        int dropped = 0;
        while (tasks.poll() != null) {
            dropped++;
        }
        if (dropped > 0) {
            log.info("Lane closed: instrument={} droppedTasks={}", instrumentId, dropped);
        }
        return dropped;
    }

    /**
     * Waits until no task of this lane is running or queued.
     *
     * @return true if idle before the timeout
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (scheduled.get() || (!closed.get() && !tasks.isEmpty())) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(idleMonitor, remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return true;
    }

    public String getInstrumentId() {
        return instrumentId;
    }

    public int queuedTasks() {
        return tasks.size();
    }

    public boolean isBusy() {
        return scheduled.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void scheduleIfIdle() {
        if (!tasks.isEmpty() && scheduled.compareAndSet(false, true)) {
            dispatch();
        }
    }

    /** Puts {@link #runNext} on the pool. Only called while {@code scheduled} is held. */
    private void dispatch() {
        try {
            executor.execute(this::runNext);
        } catch (RejectedExecutionException e) {
            log.warn("Lane task rejected by pool: instrument={} queued={}", instrumentId, tasks.size());
            markIdle();
        }
    }

    private void runNext() {
        try {
            Runnable task = closed.get() ? null : tasks.poll();
            if (task != null) {
                task.run();
            }
        } catch (RuntimeException e) {
            log.error("Lane task failed: instrument={}", instrumentId, e);
        } finally {
            if (!closed.get() && !tasks.isEmpty()) {
                // keep the lane scheduled across the hand-off so it never looks idle with work queued
                dispatch();
            } else {
                markIdle();
                if (!closed.get()) {
                    // a task queued while this one was finishing
                    scheduleIfIdle();
                }
            }
        }
    }

    private void markIdle() {
        synchronized (idleMonitor) {
            scheduled.set(false);
            idleMonitor.notifyAll();
        }
    }
}
