package com.dualedit.timing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * State shared by debounce and throttle: the callback, the latest argument, the armed trailing call
 * and the one outstanding timer.
 */
abstract class AbstractTimingController<T> implements TimingController<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractTimingController.class);

    protected final String name;
    protected final Scheduler scheduler;
    protected final TimingOptions options;
    private final Consumer<T> callback;

    protected Cancellable timer;
    protected boolean trailingArmed;
    protected T latestArgument;
    private boolean destroyed;

    protected AbstractTimingController(String name, Scheduler scheduler, TimingOptions options, Consumer<T> callback) {
        this.name = Objects.requireNonNull(name, "name");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.options = Objects.requireNonNull(options, "options");
        this.callback = Objects.requireNonNull(callback, "callback");
    }

    @Override
    public final void execute(T argument) {
        if (destroyed) {
            log.warn("Ignoring call on destroyed timing controller {}", name);
            return;
        }
        latestArgument = argument;
        onExecute(argument);
    }

    protected abstract void onExecute(T argument);

    @Override
    public void cancel() {
        cancelTimer();
        trailingArmed = false;
        latestArgument = null;
    }

    @Override
    public void flush() {
        if (!isPending()) {
            return;
        }
        cancelTimer();
        fireTrailing();
    }

    @Override
    public void destroy() {
        cancel();
        destroyed = true;
    }

    @Override
    public boolean isPending() {
        return timer != null && trailingArmed && options.isTrailing();
    }

    @Override
    public TimingOptions getOptions() {
        return options;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    protected void fireTrailing() {
        T argument = latestArgument;
        trailingArmed = false;
        latestArgument = null;
        invoke(argument);
    }

    protected void invoke(T argument) {
        log.debug("Timing controller {} firing", name);
        try {
            callback.accept(argument);
        } catch (RuntimeException e) {
            log.warn("Callback of timing controller {} failed", name, e);
        }
    }

    protected void cancelTimer() {
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + ", " + options + "]";
    }
}
