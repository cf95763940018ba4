package com.dualedit.timing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link Scheduler} backed by a single-thread {@link ScheduledExecutorService}: the event loop
 * of a live editing session. Controllers and orchestrators bound to this scheduler should only
 * be called from tasks submitted to it.
 */
public final class ExecutorScheduler implements Scheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutorScheduler.class);

    private final ScheduledExecutorService executor;

    public ExecutorScheduler() {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dualedit-scheduler");
            t.setDaemon(true);
            return t;
        }));
    }

    public ExecutorScheduler(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public Cancellable schedule(long delayMillis, Runnable task) {
        if (delayMillis < 0) {
            throw new IllegalArgumentException("delayMillis must be >= 0: " + delayMillis);
        }
        Objects.requireNonNull(task, "task");
        ScheduledFuture<?> future = executor.schedule(() -> runLogged(task), delayMillis, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    /** Failures would otherwise be captured by the future and never seen. Errors are logged and rethrown. */
    static void runLogged(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Scheduled task failed", e);
        } catch (Error e) {
            log.error("Scheduled task failed with {}", e.getClass().getSimpleName(), e);
            throw e;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
