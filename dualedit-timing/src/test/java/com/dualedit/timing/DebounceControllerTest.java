package com.dualedit.timing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DebounceControllerTest {

    private VirtualScheduler scheduler;
    private List<String> calls;

    @BeforeEach
    void setUp() {
        scheduler = new VirtualScheduler();
        calls = new ArrayList<>();
    }

    private DebounceController<String> debounce(TimingOptions options) {
        return new DebounceController<>("test", scheduler, options, calls::add);
    }

    @Test
    void execute_coalescesBurstIntoOneTrailingCallWithLatestArgument() {
        DebounceController<String> c = debounce(TimingOptions.debounce(300));

        c.execute("a");
        scheduler.advanceBy(100);
        c.execute("b");
        scheduler.advanceBy(100);
        c.execute("c");
        scheduler.advanceBy(299);
        assertTrue(calls.isEmpty());
        assertTrue(c.isPending());

        scheduler.advanceBy(1);
        assertEquals(List.of("c"), calls);
        assertFalse(c.isPending());
    }

    @Test
    void execute_leadingFiresFirstCallImmediatelyAndTrailingOnlyIfMoreCallsArrived() {
        DebounceController<String> c = debounce(TimingOptions.builder(TimingMode.DEBOUNCE)
                .delayMillis(100).leading(true).trailing(true).build());

        c.execute("first");
        assertEquals(List.of("first"), calls);
        assertFalse(c.isPending());
        scheduler.advanceBy(100);
        assertEquals(List.of("first"), calls);

        c.execute("x");
        c.execute("y");
        scheduler.advanceBy(100);
        assertEquals(List.of("first", "x", "y"), calls);
    }

    @Test
    void cancel_discardsQueuedCall() {
        DebounceController<String> c = debounce(TimingOptions.debounce(50));
        c.execute("a");
        c.cancel();
        scheduler.advanceBy(1000);
        assertTrue(calls.isEmpty());
        assertFalse(c.isPending());
    }

    @Test
    void flush_runsLatestPendingCallNowAndOnlyOnce() {
        DebounceController<String> c = debounce(TimingOptions.debounce(300));
        c.execute("a");
        c.execute("b");

        c.flush();
        assertEquals(List.of("b"), calls);

        scheduler.advanceBy(1000);
        assertEquals(List.of("b"), calls);
    }

    @Test
    void flush_withNothingPendingDoesNothing() {
        DebounceController<String> c = debounce(TimingOptions.debounce(300));
        c.flush();
        assertTrue(calls.isEmpty());
    }

    @Test
    void destroy_ignoresLaterCalls() {
        DebounceController<String> c = debounce(TimingOptions.debounce(10));
        c.execute("a");
        c.destroy();
        c.execute("b");
        scheduler.advanceBy(100);
        assertTrue(calls.isEmpty());
        assertTrue(c.isDestroyed());
    }

    @Test
    void execute_callbackExceptionDoesNotBreakController() {
        List<String> seen = new ArrayList<>();
        DebounceController<String> c = new DebounceController<>("boom", scheduler, TimingOptions.debounce(10), arg -> {
            seen.add(arg);
            throw new IllegalStateException("boom");
        });

        c.execute("a");
        scheduler.advanceBy(10);
        c.execute("b");
        scheduler.advanceBy(10);

        assertEquals(List.of("a", "b"), seen);
    }

    @Test
    void options_capDebounceDelay() {
        assertEquals(TimingOptions.MAX_DEBOUNCE_MILLIS, TimingOptions.debounce(10_000).getDelayMillis());
    }
}
