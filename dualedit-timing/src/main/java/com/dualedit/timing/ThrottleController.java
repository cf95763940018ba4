package com.dualedit.timing;

import java.util.function.Consumer;

/**
 * Lets at most one call through per interval. A call that finds the window open runs immediately
 * ({@code leading}) or is held to the end of the window; calls inside a window are collapsed into
 * one trailing call with the latest argument ({@code trailing}), which opens the next window.
 */
public final class ThrottleController<T> extends AbstractTimingController<T> {

    public ThrottleController(String name, Scheduler scheduler, TimingOptions options, Consumer<T> callback) {
        super(name, scheduler, options, callback);
        if (options.getMode() != TimingMode.THROTTLE) {
            throw new IllegalArgumentException("Throttle controller needs THROTTLE options, got " + options.getMode());
        }
    }

    @Override
    protected void onExecute(T argument) {
        if (timer != null) {
            trailingArmed = true;
            return;
        }
        timer = scheduler.schedule(options.getDelayMillis(), this::onWindowEnd);
        if (options.isLeading()) {
            trailingArmed = false;
            latestArgument = null;
            invoke(argument);
        } else {
            trailingArmed = true;
        }
    }

    private void onWindowEnd() {
        timer = null;
        if (trailingArmed && options.isTrailing()) {
            timer = scheduler.schedule(options.getDelayMillis(), this::onWindowEnd);
            fireTrailing();
        } else {
            trailingArmed = false;
            latestArgument = null;
        }
    }
}
