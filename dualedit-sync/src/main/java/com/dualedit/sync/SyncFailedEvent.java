package com.dualedit.sync;

/**
 * Published to {@link SyncFailedListener}s before the controller leaves {@link SyncState#SYNC_PROCESSING}.
 *
 * @param errorCode         code as reported (may be a code {@link ErrorType} does not know)
 * @param originalState     state the controller was in when the sync failed, always {@link SyncState#SYNC_PROCESSING}
 * @param recoveryState     state the controller returns to: the dirty state the sync started from, or
 *                          {@link SyncState#ALL_SYNCED} when it is not known
 * @param attemptedSyncFrom side the sync started from; null when not known
 * @param retryScheduled    whether a retry of the same sync has been scheduled
 */
public record SyncFailedEvent(
        String errorMessage,
        String errorCode,
        ErrorClassification classification,
        SyncState originalState,
        SyncState recoveryState,
        EditSide attemptedSyncFrom,
        RecoveryAction recovery,
        boolean retryScheduled) {

    public ErrorType errorType() {
        return ErrorType.fromCode(errorCode);
    }
}
