package com.dualedit.timing;

/** How a {@link TimingController} shapes a stream of calls. */
public enum TimingMode {
    /** Coalesce a burst into one call once the burst has been quiet for the delay. */
    DEBOUNCE,
    /** Let at most one call through per interval. */
    THROTTLE
}
