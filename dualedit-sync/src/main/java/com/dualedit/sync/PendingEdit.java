package com.dualedit.sync;

/**
 * An edit received while a sync was running.
 *
 * @param sequence arrival number, increasing across the controller's lifetime
 */
public record PendingEdit(EditSide side, long receivedAtMillis, long sequence) {
}
