package com.dualedit.sync;

import com.dualedit.timing.VirtualScheduler;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StateTransitionRulesTest {

    @Test
    void defaults_allowOnlyTheSyncCycle() {
        StateTransitionRules rules = StateTransitionRules.defaults();

        assertEquals(Set.of(SyncState.A_DIRTY, SyncState.B_DIRTY), rules.targetsFrom(SyncState.ALL_SYNCED));
        assertEquals(Set.of(SyncState.SYNC_PROCESSING), rules.targetsFrom(SyncState.A_DIRTY));
        assertTrue(rules.isAllowed(SyncState.SYNC_PROCESSING, SyncState.B_DIRTY));
        assertFalse(rules.isAllowed(SyncState.A_DIRTY, SyncState.B_DIRTY));
        assertFalse(rules.isAllowed(SyncState.ALL_SYNCED, SyncState.SYNC_PROCESSING));
        assertFalse(rules.isAllowed(SyncState.A_DIRTY, SyncState.ALL_SYNCED));
    }

    @Test
    void builder_unlistedStateHasNoTargets() {
        StateTransitionRules rules = StateTransitionRules.builder()
                .allow(SyncState.ALL_SYNCED, SyncState.A_DIRTY)
                .build();

        assertTrue(rules.isAllowed(SyncState.ALL_SYNCED, SyncState.A_DIRTY));
        assertFalse(rules.isAllowed(SyncState.ALL_SYNCED, SyncState.B_DIRTY));
        assertTrue(rules.targetsFrom(SyncState.SYNC_PROCESSING).isEmpty());
    }

    @Test
    void controller_narrowedRulesRefuseTextEdits() {
        SyncController controller = new SyncController(new VirtualScheduler());
        controller.initialize(SyncState.ALL_SYNCED, StateTransitionRules.builder()
                .allow(SyncState.ALL_SYNCED, SyncState.A_DIRTY)
                .allow(SyncState.A_DIRTY, SyncState.SYNC_PROCESSING)
                .allow(SyncState.SYNC_PROCESSING, SyncState.ALL_SYNCED, SyncState.A_DIRTY)
                .build());

        assertEquals(EditOutcome.REJECTED, controller.handleEditB());
        assertEquals(EditOutcome.APPLIED, controller.handleEditA());
    }
}
