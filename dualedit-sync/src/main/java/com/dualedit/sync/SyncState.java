package com.dualedit.sync;

/**
 * Which representation, if any, holds edits that have not been propagated yet.
 */
public enum SyncState {
    /** All representations agree; either side may be edited. */
    ALL_SYNCED,
    /** Side A (visual) was edited and is authoritative until the next sync. */
    A_DIRTY,
    /** Side B (text) was edited and is authoritative until the next sync. */
    B_DIRTY,
    /** Representations are being regenerated from the last dirty side; neither side is editable. */
    SYNC_PROCESSING;

    public boolean isDirty() {
        return this == A_DIRTY || this == B_DIRTY;
    }

    /** The dirty side for {@link #A_DIRTY}/{@link #B_DIRTY}, null otherwise. */
    public EditSide dirtySide() {
        if (this == A_DIRTY) return EditSide.A;
        if (this == B_DIRTY) return EditSide.B;
        return null;
    }
}
