package com.dualedit.sync;

@FunctionalInterface
public interface SyncFailedListener {

    /** Called while the controller is still in {@link SyncState#SYNC_PROCESSING}. Exceptions are logged and ignored. */
    void onSyncFailed(SyncFailedEvent event);
}
