package com.dualedit.sync;

/**
 * The two editable representations. A is the visual (block) editor, B the text editor.
 */
public enum EditSide {
    A,
    B;

    public SyncState dirtyState() {
        return this == A ? SyncState.A_DIRTY : SyncState.B_DIRTY;
    }

    public EditSide other() {
        return this == A ? B : A;
    }
}
