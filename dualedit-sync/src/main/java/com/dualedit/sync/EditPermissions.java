package com.dualedit.sync;

/**
 * Which sides accept edits in the current state.
 *
 * @param canSwitch     whether the user may move to the other editor without losing work (only when all synced)
 * @param lastDirtySide side a running sync started from; null outside {@link SyncState#SYNC_PROCESSING}
 */
public record EditPermissions(boolean aEditable, boolean bEditable, boolean canSwitch, EditSide lastDirtySide) {

    static EditPermissions of(SyncState state, EditSide lastDirtySide) {
        switch (state) {
            case ALL_SYNCED:
                return new EditPermissions(true, true, true, null);
            case A_DIRTY:
                return new EditPermissions(true, false, false, null);
            case B_DIRTY:
                return new EditPermissions(false, true, false, null);
            default:
                return new EditPermissions(false, false, false, lastDirtySide);
        }
    }

    public boolean isEditable(EditSide side) {
        return side == EditSide.A ? aEditable : bEditable;
    }
}
