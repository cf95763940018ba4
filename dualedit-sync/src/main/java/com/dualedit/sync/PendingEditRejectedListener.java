package com.dualedit.sync;

/**
 * Told about an edit that was queued during a sync and could not be replayed because the other side
 * became authoritative first. The owner should discard or re-apply that edit's payload.
 */
@FunctionalInterface
public interface PendingEditRejectedListener {

    void onPendingEditRejected(PendingEdit edit);
}
