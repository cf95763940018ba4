package com.dualedit.dataflow;

import com.dualedit.sync.EditSide;
import com.dualedit.sync.SyncFailedEvent;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters of one orchestrator:
 * <ul>
 *   <li>{@code dualedit.sync.success} (side)</li>
 *   <li>{@code dualedit.sync.failure} (errorCode, classification)</li>
 *   <li>{@code dualedit.edit.rejected} (side)</li>
 *   <li>{@code dualedit.sync.duration} timer (side, outcome)</li>
 * </ul>
 * Without a registry of its own an enabled instance records into a private {@link SimpleMeterRegistry}.
 * A disabled instance records nothing.
 */
public final class SyncMetrics {

    static final String SYNC_SUCCESS = "dualedit.sync.success";
    static final String SYNC_FAILURE = "dualedit.sync.failure";
    static final String EDIT_REJECTED = "dualedit.edit.rejected";
    static final String SYNC_DURATION = "dualedit.sync.duration";

    private static final SyncMetrics DISABLED = new SyncMetrics(null);

    private final MeterRegistry registry;

    private SyncMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public static SyncMetrics using(MeterRegistry registry) {
        return new SyncMetrics(registry != null ? registry : new SimpleMeterRegistry());
    }

    public static SyncMetrics disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return registry != null;
    }

    /** Registry meters go to; null when disabled. */
    public MeterRegistry getRegistry() {
        return registry;
    }

    void recordSuccess(EditSide side, long durationNanos) {
        if (registry == null) return;
        registry.counter(SYNC_SUCCESS, "side", sideTag(side)).increment();
        duration(side, "success", durationNanos);
    }

    void recordFailure(SyncFailedEvent event) {
        if (registry == null) return;
        registry.counter(SYNC_FAILURE,
                "errorCode", event.errorType().name(),
                "classification", event.classification().name()
        ).increment();
    }

    void recordFailedAttempt(EditSide side, long durationNanos) {
        if (registry == null) return;
        duration(side, "failure", durationNanos);
    }

    void recordRejected(EditSide side) {
        if (registry == null) return;
        registry.counter(EDIT_REJECTED, "side", sideTag(side)).increment();
    }

    private void duration(EditSide side, String outcome, long durationNanos) {
        Timer.builder(SYNC_DURATION)
                .tag("side", sideTag(side))
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    private static String sideTag(EditSide side) {
        return side != null ? side.name() : "unknown";
    }
}
