package com.dualedit.timing;

import java.util.Comparator;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Manually advanced clock. Tasks run on the calling thread inside {@link #advanceBy(long)},
 * {@link #advanceTo(long)} or {@link #runUntilIdle()}, in due-time order (ties in scheduling order).
 * Tasks scheduled while advancing run in the same call if they fall due before the target time.
 * <p>
 * Exceptions thrown by tasks propagate to the caller of the advance method.
 */
public final class VirtualScheduler implements Scheduler {

    private static final int MAX_TASKS_PER_RUN = 100_000;

    private final PriorityQueue<Task> queue = new PriorityQueue<>(
            Comparator.comparingLong((Task t) -> t.dueTime).thenComparingLong(t -> t.sequence));
    private long now;
    private long sequence;

    public VirtualScheduler() {
        this(0L);
    }

    public VirtualScheduler(long startMillis) {
        this.now = startMillis;
    }

    @Override
    public Cancellable schedule(long delayMillis, Runnable task) {
        if (delayMillis < 0) {
            throw new IllegalArgumentException("delayMillis must be >= 0: " + delayMillis);
        }
        Task t = new Task(now + delayMillis, sequence++, Objects.requireNonNull(task, "task"));
        queue.add(t);
        return t;
    }

    @Override
    public long currentTimeMillis() {
        return now;
    }

    public void advanceBy(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis must be >= 0: " + millis);
        }
        advanceTo(now + millis);
    }

    public void advanceTo(long targetMillis) {
        int ran = 0;
        while (!queue.isEmpty() && queue.peek().dueTime <= targetMillis) {
            runNext();
            if (++ran > MAX_TASKS_PER_RUN) {
                throw new IllegalStateException("Too many tasks while advancing; a task is probably rescheduling itself");
            }
        }
        now = Math.max(now, targetMillis);
    }

    /** Runs every queued task, moving the clock forward to each one's due time. */
    public void runUntilIdle() {
        int ran = 0;
        while (!queue.isEmpty()) {
            runNext();
            if (++ran > MAX_TASKS_PER_RUN) {
                throw new IllegalStateException("Scheduler never became idle");
            }
        }
    }

    public int pendingTaskCount() {
        return queue.size();
    }

    private void runNext() {
        Task t = queue.poll();
        now = Math.max(now, t.dueTime);
        t.done = true;
        t.action.run();
    }

    private final class Task implements Cancellable {
        private final long dueTime;
        private final long sequence;
        private final Runnable action;
        private boolean done;

        private Task(long dueTime, long sequence, Runnable action) {
            this.dueTime = dueTime;
            this.sequence = sequence;
            this.action = action;
        }

        @Override
        public boolean cancel() {
            if (done) {
                return false;
            }
            done = true;
            return queue.remove(this);
        }
    }
}
