package com.dualedit.dataflow;

import java.util.List;

/**
 * Result of {@link DataFlowOrchestrator#checkSyncStatus()}.
 *
 * @param conflicts human-readable descriptions; empty when {@code inSync}
 */
public record SyncStatusReport(boolean inSync, List<String> conflicts) {

    public SyncStatusReport {
        conflicts = List.copyOf(conflicts);
    }

    static SyncStatusReport of(List<String> conflicts) {
        return new SyncStatusReport(conflicts.isEmpty(), conflicts);
    }
}
