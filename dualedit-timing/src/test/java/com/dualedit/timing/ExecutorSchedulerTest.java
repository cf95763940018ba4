package com.dualedit.timing;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutorSchedulerTest {

    @Test
    void schedule_runsTaskAfterDelay() throws InterruptedException {
        try (ExecutorScheduler scheduler = new ExecutorScheduler()) {
            CountDownLatch ran = new CountDownLatch(1);
            scheduler.schedule(10, ran::countDown);

            assertTrue(ran.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void cancel_preventsTask() throws InterruptedException {
        try (ExecutorScheduler scheduler = new ExecutorScheduler()) {
            AtomicBoolean ran = new AtomicBoolean();
            Cancellable handle = scheduler.schedule(200, () -> ran.set(true));

            assertTrue(handle.cancel());
            CountDownLatch after = new CountDownLatch(1);
            scheduler.schedule(300, after::countDown);
            assertTrue(after.await(5, TimeUnit.SECONDS));
            assertFalse(ran.get());
        }
    }

    @Test
    void schedule_failingTaskDoesNotKillLoop() throws InterruptedException {
        try (ExecutorScheduler scheduler = new ExecutorScheduler()) {
            scheduler.submit(() -> {
                throw new IllegalStateException("boom");
            });
            CountDownLatch next = new CountDownLatch(1);
            scheduler.submit(next::countDown);

            assertTrue(next.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void schedule_taskFailingWithErrorDoesNotKillLoop() throws InterruptedException {
        try (ExecutorScheduler scheduler = new ExecutorScheduler()) {
            scheduler.submit(() -> {
                throw new StackOverflowError("deep");
            });
            CountDownLatch next = new CountDownLatch(1);
            scheduler.submit(next::countDown);

            assertTrue(next.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void runLogged_swallowsRuntimeExceptionsButRethrowsErrors() {
        ExecutorScheduler.runLogged(() -> {
            throw new IllegalStateException("boom");
        });
        StackOverflowError error = assertThrows(StackOverflowError.class, () -> ExecutorScheduler.runLogged(() -> {
            throw new StackOverflowError("deep");
        }));
        assertEquals("deep", error.getMessage());
    }

    @Test
    void schedule_rejectsNegativeDelay() {
        try (ExecutorScheduler scheduler = new ExecutorScheduler()) {
            assertThrows(IllegalArgumentException.class, () -> scheduler.schedule(-1, () -> { }));
        }
    }
}
