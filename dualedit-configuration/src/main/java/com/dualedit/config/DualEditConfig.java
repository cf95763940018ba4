package com.dualedit.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Configuration of a dual-edit session, loaded from environment variables.
 * <p>
 * Timing: DUALEDIT_DEBOUNCE_MS, DUALEDIT_DEBOUNCE_LEADING. Sync: DUALEDIT_SYNC_TIMEOUT_MS, DUALEDIT_RETRY_DELAY_MS,
 * DUALEDIT_PENDING_QUEUE_CAPACITY, DUALEDIT_VERSION_HISTORY_LIMIT, DUALEDIT_VALIDATE_ON_SYNC.
 * Metrics: DUALEDIT_METRICS_ENABLED.
 * <p>
 * Missing, blank or unparseable values fall back to the defaults (unparseable ones with a warning); out-of-range
 * values are rejected by {@link Builder#build()}. Booleans accept true/false and 1/0.
 */
public final class DualEditConfig {

    private static final Logger log = LoggerFactory.getLogger(DualEditConfig.class);

    static final String ENV_DEBOUNCE_MS = "DUALEDIT_DEBOUNCE_MS";
    static final String ENV_DEBOUNCE_LEADING = "DUALEDIT_DEBOUNCE_LEADING";
    static final String ENV_SYNC_TIMEOUT_MS = "DUALEDIT_SYNC_TIMEOUT_MS";
    static final String ENV_RETRY_DELAY_MS = "DUALEDIT_RETRY_DELAY_MS";
    static final String ENV_PENDING_QUEUE_CAPACITY = "DUALEDIT_PENDING_QUEUE_CAPACITY";
    static final String ENV_VERSION_HISTORY_LIMIT = "DUALEDIT_VERSION_HISTORY_LIMIT";
    static final String ENV_VALIDATE_ON_SYNC = "DUALEDIT_VALIDATE_ON_SYNC";
    static final String ENV_METRICS_ENABLED = "DUALEDIT_METRICS_ENABLED";

    private static final long DEFAULT_DEBOUNCE_MS = 300;
    private static final boolean DEFAULT_DEBOUNCE_LEADING = false;
    private static final long DEFAULT_SYNC_TIMEOUT_MS = 5000;
    private static final long DEFAULT_RETRY_DELAY_MS = 1000;
    private static final int DEFAULT_PENDING_QUEUE_CAPACITY = 64;
    private static final int DEFAULT_VERSION_HISTORY_LIMIT = 50;
    private static final boolean DEFAULT_VALIDATE_ON_SYNC = true;
    private static final boolean DEFAULT_METRICS_ENABLED = true;

    private final long debounceMs;
    private final boolean debounceLeading;
    private final long syncTimeoutMs;
    private final long retryDelayMs;
    private final int pendingQueueCapacity;
    private final int versionHistoryLimit;
    private final boolean validateOnSync;
    private final boolean metricsEnabled;

    private DualEditConfig(Builder b) {
        this.debounceMs = b.debounceMs;
        this.debounceLeading = b.debounceLeading;
        this.syncTimeoutMs = b.syncTimeoutMs;
        this.retryDelayMs = b.retryDelayMs;
        this.pendingQueueCapacity = b.pendingQueueCapacity;
        this.versionHistoryLimit = b.versionHistoryLimit;
        this.validateOnSync = b.validateOnSync;
        this.metricsEnabled = b.metricsEnabled;
    }

    public static DualEditConfig defaults() {
        return builder().build();
    }

    public static DualEditConfig fromEnvironment() {
        return load(System::getenv);
    }

    /** Same parsing as {@link #fromEnvironment()}, reading from {@code values} instead. */
    public static DualEditConfig fromMap(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        return load(values::get);
    }

    private static DualEditConfig load(Function<String, String> env) {
        return builder()
                .debounceMs(parseLong(env, ENV_DEBOUNCE_MS, DEFAULT_DEBOUNCE_MS))
                .debounceLeading(parseBoolean(env, ENV_DEBOUNCE_LEADING, DEFAULT_DEBOUNCE_LEADING))
                .syncTimeoutMs(parseLong(env, ENV_SYNC_TIMEOUT_MS, DEFAULT_SYNC_TIMEOUT_MS))
                .retryDelayMs(parseLong(env, ENV_RETRY_DELAY_MS, DEFAULT_RETRY_DELAY_MS))
                .pendingQueueCapacity(parseInt(env, ENV_PENDING_QUEUE_CAPACITY, DEFAULT_PENDING_QUEUE_CAPACITY))
                .versionHistoryLimit(parseInt(env, ENV_VERSION_HISTORY_LIMIT, DEFAULT_VERSION_HISTORY_LIMIT))
                .validateOnSync(parseBoolean(env, ENV_VALIDATE_ON_SYNC, DEFAULT_VALIDATE_ON_SYNC))
                .metricsEnabled(parseBoolean(env, ENV_METRICS_ENABLED, DEFAULT_METRICS_ENABLED))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .debounceMs(debounceMs)
                .debounceLeading(debounceLeading)
                .syncTimeoutMs(syncTimeoutMs)
                .retryDelayMs(retryDelayMs)
                .pendingQueueCapacity(pendingQueueCapacity)
                .versionHistoryLimit(versionHistoryLimit)
                .validateOnSync(validateOnSync)
                .metricsEnabled(metricsEnabled);
    }

    /** Quiet period before an edit triggers a sync. Default 300. */
    public long getDebounceMs() {
        return debounceMs;
    }

    /** Whether the first edit of a burst also syncs immediately. Default false. */
    public boolean isDebounceLeading() {
        return debounceLeading;
    }

    /** How long a sync may stay in progress before it fails with SYNC_TIMEOUT. Default 5000. */
    public long getSyncTimeoutMs() {
        return syncTimeoutMs;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public int getPendingQueueCapacity() {
        return pendingQueueCapacity;
    }

    public int getVersionHistoryLimit() {
        return versionHistoryLimit;
    }

    /** Whether a sync validates the tree before committing it. Default true. */
    public boolean isValidateOnSync() {
        return validateOnSync;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    @Override
    public String toString() {
        return "DualEditConfig{debounceMs=" + debounceMs + ", debounceLeading=" + debounceLeading
                + ", syncTimeoutMs=" + syncTimeoutMs + ", retryDelayMs=" + retryDelayMs
                + ", pendingQueueCapacity=" + pendingQueueCapacity + ", versionHistoryLimit=" + versionHistoryLimit
                + ", validateOnSync=" + validateOnSync + ", metricsEnabled=" + metricsEnabled + "}";
    }

    private static boolean parseBoolean(Function<String, String> env, String name, boolean defaultValue) {
        String value = env.apply(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String v = value.trim();
        if ("true".equalsIgnoreCase(v) || "1".equals(v)) {
            return true;
        }
        if ("false".equalsIgnoreCase(v) || "0".equals(v)) {
            return false;
        }
        log.warn("Ignoring {}={}: not a boolean, using default {}", name, value, defaultValue);
        return defaultValue;
    }

    private static int parseInt(Function<String, String> env, String name, int defaultValue) {
        String value = env.apply(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not an integer, using default {}", name, value, defaultValue);
            return defaultValue;
        }
    }

    private static long parseLong(Function<String, String> env, String name, long defaultValue) {
        String value = env.apply(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not an integer, using default {}", name, value, defaultValue);
            return defaultValue;
        }
    }

    public static final class Builder {
        private long debounceMs = DEFAULT_DEBOUNCE_MS;
        private boolean debounceLeading = DEFAULT_DEBOUNCE_LEADING;
        private long syncTimeoutMs = DEFAULT_SYNC_TIMEOUT_MS;
        private long retryDelayMs = DEFAULT_RETRY_DELAY_MS;
        private int pendingQueueCapacity = DEFAULT_PENDING_QUEUE_CAPACITY;
        private int versionHistoryLimit = DEFAULT_VERSION_HISTORY_LIMIT;
        private boolean validateOnSync = DEFAULT_VALIDATE_ON_SYNC;
        private boolean metricsEnabled = DEFAULT_METRICS_ENABLED;

        public Builder debounceMs(long debounceMs) {
            this.debounceMs = debounceMs;
            return this;
        }

        public Builder debounceLeading(boolean debounceLeading) {
            this.debounceLeading = debounceLeading;
            return this;
        }

        public Builder syncTimeoutMs(long syncTimeoutMs) {
            this.syncTimeoutMs = syncTimeoutMs;
            return this;
        }

        public Builder retryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
            return this;
        }

        public Builder pendingQueueCapacity(int pendingQueueCapacity) {
            this.pendingQueueCapacity = pendingQueueCapacity;
            return this;
        }

        public Builder versionHistoryLimit(int versionHistoryLimit) {
            this.versionHistoryLimit = versionHistoryLimit;
            return this;
        }

        public Builder validateOnSync(boolean validateOnSync) {
            this.validateOnSync = validateOnSync;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        /** @throws IllegalArgumentException if a delay is negative, the timeout is not positive or a bound is below 1 */
        public DualEditConfig build() {
            require(debounceMs >= 0, ENV_DEBOUNCE_MS + " must be >= 0: " + debounceMs);
            require(syncTimeoutMs > 0, ENV_SYNC_TIMEOUT_MS + " must be > 0: " + syncTimeoutMs);
            require(retryDelayMs >= 0, ENV_RETRY_DELAY_MS + " must be >= 0: " + retryDelayMs);
            require(pendingQueueCapacity >= 1, ENV_PENDING_QUEUE_CAPACITY + " must be >= 1: " + pendingQueueCapacity);
            require(versionHistoryLimit >= 1, ENV_VERSION_HISTORY_LIMIT + " must be >= 1: " + versionHistoryLimit);
            return new DualEditConfig(this);
        }

        private static void require(boolean condition, String message) {
            if (!condition) {
                throw new IllegalArgumentException(message);
            }
        }
    }
}
