package com.dualedit.timing;

import java.util.function.Consumer;

/**
 * Coalesces a burst of calls: every call restarts the quiet period. With {@code leading} the first
 * call of a burst runs immediately; with {@code trailing} the latest argument runs once the burst
 * has been quiet for the delay (only if a call arrived after the leading one).
 */
public final class DebounceController<T> extends AbstractTimingController<T> {

    public DebounceController(String name, Scheduler scheduler, TimingOptions options, Consumer<T> callback) {
        super(name, scheduler, options, callback);
        if (options.getMode() != TimingMode.DEBOUNCE) {
            throw new IllegalArgumentException("Debounce controller needs DEBOUNCE options, got " + options.getMode());
        }
    }

    @Override
    protected void onExecute(T argument) {
        boolean burstStart = timer == null;
        cancelTimer();
        timer = scheduler.schedule(options.getDelayMillis(), this::onQuiet);
        if (burstStart && options.isLeading()) {
            trailingArmed = false;
            latestArgument = null;
            invoke(argument);
        } else {
            trailingArmed = true;
        }
    }

    private void onQuiet() {
        timer = null;
        if (trailingArmed && options.isTrailing()) {
            fireTrailing();
        } else {
            trailingArmed = false;
            latestArgument = null;
        }
    }
}
