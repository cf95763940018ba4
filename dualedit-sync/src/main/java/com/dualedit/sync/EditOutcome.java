package com.dualedit.sync;

/** What {@link SyncController#handleEdit(EditSide)} did with an edit. */
public enum EditOutcome {
    /** The side is (now) dirty. */
    APPLIED,
    /** A sync is running; the edit waits in the pending queue and is replayed afterwards. */
    QUEUED,
    /** The other side is authoritative; the edit must be discarded by the caller. */
    REJECTED
}
