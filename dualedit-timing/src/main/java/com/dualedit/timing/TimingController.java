package com.dualedit.timing;

/**
 * Wraps a callback with debounce or throttle semantics.
 *
 * @param <T> argument passed through to the callback; only the latest argument of a burst is delivered
 */
public interface TimingController<T> {

    /** Records a call; whether and when the callback runs depends on the mode and options. */
    void execute(T argument);

    /** Discards the queued call, if any. The callback is not invoked. */
    void cancel();

    /** Runs the queued call now with its latest argument. No-op when nothing is queued. */
    void flush();

    /** Cancels and permanently disables this controller; later {@link #execute} calls are ignored. */
    void destroy();

    /** Whether a call is queued and will reach the callback unless cancelled. */
    boolean isPending();

    TimingOptions getOptions();
}
