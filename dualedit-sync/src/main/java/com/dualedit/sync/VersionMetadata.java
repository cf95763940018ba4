package com.dualedit.sync;

/**
 * A point at which all representations agreed.
 *
 * @param version increasing, starting at 0 for the state the controller was initialized in
 * @param reason  why the version was recorded ("initialize", "sync from A", ...)
 */
public record VersionMetadata(int version, long timestampMillis, SyncState state, String reason) {
}
