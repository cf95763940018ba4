package com.dualedit.sync;

@FunctionalInterface
public interface StateChangeListener {

    /** Called after the state changed; {@code from != to}. Exceptions are logged and ignored. */
    void onStateChange(SyncState from, SyncState to);
}
