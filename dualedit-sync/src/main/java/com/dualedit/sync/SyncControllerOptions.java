package com.dualedit.sync;

/**
 * Tunables of a {@link SyncController}.
 */
public final class SyncControllerOptions {

    public static final long DEFAULT_SYNC_TIMEOUT_MS = 5000;
    public static final long DEFAULT_RETRY_DELAY_MS = 1000;
    public static final int DEFAULT_PENDING_QUEUE_CAPACITY = 64;
    public static final int DEFAULT_VERSION_HISTORY_LIMIT = 50;

    private static final SyncControllerOptions DEFAULTS = builder().build();

    private final long syncTimeoutMs;
    private final long retryDelayMs;
    private final int pendingQueueCapacity;
    private final int versionHistoryLimit;

    private SyncControllerOptions(Builder b) {
        this.syncTimeoutMs = b.syncTimeoutMs;
        this.retryDelayMs = b.retryDelayMs;
        this.pendingQueueCapacity = b.pendingQueueCapacity;
        this.versionHistoryLimit = b.versionHistoryLimit;
    }

    public static SyncControllerOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

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

    @Override
    public String toString() {
        return "SyncControllerOptions{syncTimeoutMs=" + syncTimeoutMs + ", retryDelayMs=" + retryDelayMs
                + ", pendingQueueCapacity=" + pendingQueueCapacity + ", versionHistoryLimit=" + versionHistoryLimit + "}";
    }

    public static final class Builder {
        private long syncTimeoutMs = DEFAULT_SYNC_TIMEOUT_MS;
        private long retryDelayMs = DEFAULT_RETRY_DELAY_MS;
        private int pendingQueueCapacity = DEFAULT_PENDING_QUEUE_CAPACITY;
        private int versionHistoryLimit = DEFAULT_VERSION_HISTORY_LIMIT;

        private Builder() {
        }

        public Builder syncTimeoutMs(long syncTimeoutMs) {
            if (syncTimeoutMs <= 0) {
                throw new IllegalArgumentException("syncTimeoutMs must be > 0: " + syncTimeoutMs);
            }
            this.syncTimeoutMs = syncTimeoutMs;
            return this;
        }

        public Builder retryDelayMs(long retryDelayMs) {
            if (retryDelayMs < 0) {
                throw new IllegalArgumentException("retryDelayMs must be >= 0: " + retryDelayMs);
            }
            this.retryDelayMs = retryDelayMs;
            return this;
        }

        public Builder pendingQueueCapacity(int pendingQueueCapacity) {
            if (pendingQueueCapacity < 1) {
                throw new IllegalArgumentException("pendingQueueCapacity must be >= 1: " + pendingQueueCapacity);
            }
            this.pendingQueueCapacity = pendingQueueCapacity;
            return this;
        }

        public Builder versionHistoryLimit(int versionHistoryLimit) {
            if (versionHistoryLimit < 1) {
                throw new IllegalArgumentException("versionHistoryLimit must be >= 1: " + versionHistoryLimit);
            }
            this.versionHistoryLimit = versionHistoryLimit;
            return this;
        }

        public SyncControllerOptions build() {
            return new SyncControllerOptions(this);
        }
    }
}
