package com.dualedit.timing;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VirtualSchedulerTest {

    @Test
    void advanceBy_runsDueTasksInDueTimeOrder() {
        VirtualScheduler scheduler = new VirtualScheduler();
        List<String> ran = new ArrayList<>();
        scheduler.schedule(200, () -> ran.add("late"));
        scheduler.schedule(100, () -> ran.add("early"));
        scheduler.schedule(100, () -> ran.add("early-second"));

        scheduler.advanceBy(150);
        assertEquals(List.of("early", "early-second"), ran);
        assertEquals(150, scheduler.currentTimeMillis());

        scheduler.advanceBy(50);
        assertEquals(List.of("early", "early-second", "late"), ran);
    }

    @Test
    void advanceBy_runsTasksScheduledByTasksWhenDue() {
        VirtualScheduler scheduler = new VirtualScheduler();
        List<Long> times = new ArrayList<>();
        scheduler.schedule(10, () -> {
            times.add(scheduler.currentTimeMillis());
            scheduler.schedule(10, () -> times.add(scheduler.currentTimeMillis()));
        });

        scheduler.advanceBy(25);

        assertEquals(List.of(10L, 20L), times);
        assertEquals(25, scheduler.currentTimeMillis());
    }

    @Test
    void cancel_preventsExecutionAndReportsOnlyOnce() {
        VirtualScheduler scheduler = new VirtualScheduler();
        List<String> ran = new ArrayList<>();
        Cancellable handle = scheduler.schedule(10, () -> ran.add("x"));

        assertTrue(handle.cancel());
        assertFalse(handle.cancel());
        scheduler.advanceBy(100);

        assertTrue(ran.isEmpty());
        assertEquals(0, scheduler.pendingTaskCount());
    }

    @Test
    void cancel_afterRunReturnsFalse() {
        VirtualScheduler scheduler = new VirtualScheduler();
        Cancellable handle = scheduler.schedule(0, () -> { });
        scheduler.runUntilIdle();
        assertFalse(handle.cancel());
    }

    @Test
    void schedule_rejectsNegativeDelay() {
        VirtualScheduler scheduler = new VirtualScheduler();
        assertThrows(IllegalArgumentException.class, () -> scheduler.schedule(-1, () -> { }));
    }
}
