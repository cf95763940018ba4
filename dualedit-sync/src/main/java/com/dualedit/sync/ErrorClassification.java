package com.dualedit.sync;

/**
 * Failure classes and their recovery policy.
 */
public enum ErrorClassification {
    /** Infrastructure trouble (timeout, unavailable service, exhausted resources). */
    SYSTEM(RecoveryAction.ROLLBACK_TO_STABLE, 0),
    /** The user's input cannot be synced (parse, validation, schema). */
    DATA(RecoveryAction.KEEP_DIRTY_STATE, 0),
    /** Treated like {@link #SYSTEM}, with one retry. */
    UNKNOWN(RecoveryAction.ROLLBACK_TO_STABLE, 1);

    private final RecoveryAction recoveryAction;
    private final int maxRetries;

    ErrorClassification(RecoveryAction recoveryAction, int maxRetries) {
        this.recoveryAction = recoveryAction;
        this.maxRetries = maxRetries;
    }

    public RecoveryAction recoveryAction() {
        return recoveryAction;
    }

    public int maxRetries() {
        return maxRetries;
    }
}
