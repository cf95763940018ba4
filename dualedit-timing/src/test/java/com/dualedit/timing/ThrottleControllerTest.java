package com.dualedit.timing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThrottleControllerTest {

    private VirtualScheduler scheduler;
    private List<Integer> calls;

    @BeforeEach
    void setUp() {
        scheduler = new VirtualScheduler();
        calls = new ArrayList<>();
    }

    @Test
    void execute_firesLeadingThenLatestAtEndOfWindow() {
        ThrottleController<Integer> c = new ThrottleController<>("t", scheduler, TimingOptions.throttle(100), calls::add);

        c.execute(1);
        c.execute(2);
        c.execute(3);
        assertEquals(List.of(1), calls);
        assertTrue(c.isPending());

        scheduler.advanceBy(100);
        assertEquals(List.of(1, 3), calls);

        c.execute(4);
        assertEquals(List.of(1, 3), calls, "trailing call opened a new window");
        scheduler.advanceBy(100);
        assertEquals(List.of(1, 3, 4), calls);
    }

    @Test
    void execute_atMostOncePerIntervalUnderSteadyCalls() {
        ThrottleController<Integer> c = new ThrottleController<>("t", scheduler, TimingOptions.throttle(100), calls::add);
        for (int i = 0; i < 50; i++) {
            c.execute(i);
            scheduler.advanceBy(10);
        }
        scheduler.runUntilIdle();
        assertTrue(calls.size() <= 6, "got " + calls);
        assertEquals(49, calls.get(calls.size() - 1));
    }

    @Test
    void execute_trailingOnlyDefersFirstCall() {
        ThrottleController<Integer> c = new ThrottleController<>("t", scheduler,
                TimingOptions.builder(TimingMode.THROTTLE).delayMillis(100).leading(false).build(), calls::add);
        c.execute(1);
        assertTrue(calls.isEmpty());
        scheduler.advanceBy(100);
        assertEquals(List.of(1), calls);
    }

    @Test
    void execute_leadingOnlyDropsCallsInsideWindow() {
        ThrottleController<Integer> c = new ThrottleController<>("t", scheduler,
                TimingOptions.builder(TimingMode.THROTTLE).delayMillis(100).trailing(false).build(), calls::add);
        c.execute(1);
        c.execute(2);
        assertFalse(c.isPending());
        scheduler.advanceBy(100);
        c.execute(3);
        assertEquals(List.of(1, 3), calls);
    }

    @Test
    void options_raiseThrottleIntervalToMinimum() {
        assertEquals(TimingOptions.MIN_THROTTLE_MILLIS, TimingOptions.throttle(5).getDelayMillis());
    }

    @Test
    void constructor_rejectsDebounceOptions() {
        assertThrows(IllegalArgumentException.class,
                () -> new ThrottleController<Integer>("t", scheduler, TimingOptions.debounce(10), calls::add));
    }

    @Test
    void options_requireAnEdge() {
        assertThrows(IllegalArgumentException.class,
                () -> TimingOptions.builder(TimingMode.THROTTLE).leading(false).trailing(false).build());
    }
}
