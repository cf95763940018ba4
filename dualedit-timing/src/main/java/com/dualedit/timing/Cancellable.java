package com.dualedit.timing;

/**
 * Handle returned by {@link Scheduler#schedule(long, Runnable)}.
 */
@FunctionalInterface
public interface Cancellable {

    /**
     * Prevents the task from running if it has not run yet.
     *
     * @return true if this call cancelled the task; false if it had already run or been cancelled
     */
    boolean cancel();
}
