package com.dualedit.dataflow;

import com.dualedit.sync.EditSide;
import com.dualedit.sync.SyncFailedEvent;

/**
 * Observer of an orchestrator; typically the UI layer that pushes regenerated representations into the editors.
 * Observer-only: implementations must not call back into the orchestrator to fail or veto a sync. If a
 * listener throws, the orchestrator logs it and continues with the next listener.
 */
public interface DataFlowListener {

    /** A sync or rollback made {@code snapshot} the current state of all representations. */
    default void onSnapshotCommitted(RepresentationSnapshot snapshot) {
    }

    default void onSyncFailed(SyncFailedEvent event) {
    }

    /** {@link DataFlowOrchestrator#checkSyncStatus()} found representations that disagree. */
    default void onConflict(SyncStatusReport report) {
    }

    /** An edit on {@code side} was discarded because the other side holds unsynced edits. */
    default void onEditRejected(EditSide side) {
    }
}
