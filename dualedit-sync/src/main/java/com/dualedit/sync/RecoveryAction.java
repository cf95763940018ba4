package com.dualedit.sync;

/** What the owner of the representations should do after a failed sync. */
public enum RecoveryAction {
    /** Restore the non-dirty representations from the last fully synced snapshot. */
    ROLLBACK_TO_STABLE,
    /** Leave everything as is; the user fixes their input on the dirty side. */
    KEEP_DIRTY_STATE
}
