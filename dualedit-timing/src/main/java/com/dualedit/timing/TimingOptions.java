package com.dualedit.timing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Immutable settings for a {@link TimingController}.
 * <p>
 * Debounce delays above {@value #MAX_DEBOUNCE_MILLIS} ms and throttle intervals below
 * {@value #MIN_THROTTLE_MILLIS} ms are clamped; an editor that waits longer than two seconds
 * feels broken, and a faster throttle would resync on every keystroke anyway.
 */
public final class TimingOptions {

    private static final Logger log = LoggerFactory.getLogger(TimingOptions.class);

    public static final long DEFAULT_DEBOUNCE_MILLIS = 300;
    public static final long DEFAULT_THROTTLE_MILLIS = 100;
    public static final long MAX_DEBOUNCE_MILLIS = 2000;
    public static final long MIN_THROTTLE_MILLIS = 50;

    private final TimingMode mode;
    private final long delayMillis;
    private final boolean leading;
    private final boolean trailing;

    private TimingOptions(Builder b) {
        this.mode = b.mode;
        this.delayMillis = clamp(b.mode, b.delayMillis);
        this.leading = b.leading;
        this.trailing = b.trailing;
    }

    /** Trailing-edge debounce with the given quiet period. */
    public static TimingOptions debounce(long delayMillis) {
        return builder(TimingMode.DEBOUNCE).delayMillis(delayMillis).build();
    }

    /** Leading and trailing throttle with the given interval. */
    public static TimingOptions throttle(long intervalMillis) {
        return builder(TimingMode.THROTTLE).delayMillis(intervalMillis).build();
    }

    public static TimingOptions defaults(TimingMode mode) {
        return builder(mode).build();
    }

    public static Builder builder(TimingMode mode) {
        return new Builder(mode);
    }

    private static long clamp(TimingMode mode, long delayMillis) {
        if (mode == TimingMode.DEBOUNCE && delayMillis > MAX_DEBOUNCE_MILLIS) {
            log.debug("Debounce delay {} ms capped at {} ms", delayMillis, MAX_DEBOUNCE_MILLIS);
            return MAX_DEBOUNCE_MILLIS;
        }
        if (mode == TimingMode.THROTTLE && delayMillis < MIN_THROTTLE_MILLIS) {
            log.debug("Throttle interval {} ms raised to {} ms", delayMillis, MIN_THROTTLE_MILLIS);
            return MIN_THROTTLE_MILLIS;
        }
        return delayMillis;
    }

    public TimingMode getMode() {
        return mode;
    }

    /** Quiet period (debounce) or interval (throttle). */
    public long getDelayMillis() {
        return delayMillis;
    }

    public boolean isLeading() {
        return leading;
    }

    public boolean isTrailing() {
        return trailing;
    }

    public Builder toBuilder() {
        return new Builder(mode).delayMillis(delayMillis).leading(leading).trailing(trailing);
    }

    @Override
    public String toString() {
        return mode + "{delay=" + delayMillis + "ms, leading=" + leading + ", trailing=" + trailing + "}";
    }

    public static final class Builder {
        private final TimingMode mode;
        private long delayMillis;
        private boolean leading;
        private boolean trailing = true;

        private Builder(TimingMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            this.delayMillis = mode == TimingMode.DEBOUNCE ? DEFAULT_DEBOUNCE_MILLIS : DEFAULT_THROTTLE_MILLIS;
            this.leading = mode == TimingMode.THROTTLE;
        }

        public Builder delayMillis(long delayMillis) {
            this.delayMillis = delayMillis;
            return this;
        }

        public Builder leading(boolean leading) {
            this.leading = leading;
            return this;
        }

        public Builder trailing(boolean trailing) {
            this.trailing = trailing;
            return this;
        }

        public TimingOptions build() {
            if (delayMillis < 0) {
                throw new IllegalArgumentException("delayMillis must be >= 0: " + delayMillis);
            }
            if (!leading && !trailing) {
                throw new IllegalArgumentException("At least one of leading or trailing must be enabled");
            }
            return new TimingOptions(this);
        }
    }
}
