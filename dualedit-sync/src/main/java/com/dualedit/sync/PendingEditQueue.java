package com.dualedit.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded FIFO of edits received during {@link SyncState#SYNC_PROCESSING}. When full, the oldest edit is
 * dropped to make room.
 */
public final class PendingEditQueue {

    private static final Logger log = LoggerFactory.getLogger(PendingEditQueue.class);

    private final int capacity;
    private final Deque<PendingEdit> edits = new ArrayDeque<>();

    public PendingEditQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        }
        this.capacity = capacity;
    }

    /** @return the edit dropped to make room, if any */
    public Optional<PendingEdit> offer(PendingEdit edit) {
        PendingEdit dropped = null;
        if (edits.size() == capacity) {
            dropped = edits.pollFirst();
            log.warn("Pending edit queue full (capacity {}); dropped oldest edit {}", capacity, dropped);
        }
        edits.addLast(edit);
        return Optional.ofNullable(dropped);
    }

    /** Removes and returns all edits in arrival order. */
    public List<PendingEdit> drain() {
        List<PendingEdit> out = new ArrayList<>(edits);
        edits.clear();
        return out;
    }

    public List<PendingEdit> snapshot() {
        return List.copyOf(edits);
    }

    public void clear() {
        edits.clear();
    }

    public int size() {
        return edits.size();
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    public int capacity() {
        return capacity;
    }
}
