package com.dualedit.timing;

/**
 * Source of time and delayed execution for timing and sync logic.
 * Everything that waits (debounce quiet periods, throttle windows, sync timeouts, retries)
 * goes through a scheduler so the same code runs on a real event loop ({@link ExecutorScheduler})
 * or a manually advanced clock ({@link VirtualScheduler}).
 * <p>
 * Implementations run all tasks on one logical thread; callers must not assume tasks run concurrently.
 */
public interface Scheduler {

    /**
     * Runs {@code task} once after {@code delayMillis}.
     *
     * @throws IllegalArgumentException if delayMillis is negative
     */
    Cancellable schedule(long delayMillis, Runnable task);

    /** Current time in milliseconds as seen by this scheduler. */
    long currentTimeMillis();

    /** Runs {@code task} on the next turn of the loop. */
    default Cancellable submit(Runnable task) {
        return schedule(0, task);
    }
}
