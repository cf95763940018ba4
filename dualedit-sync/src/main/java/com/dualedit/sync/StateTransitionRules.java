package com.dualedit.sync;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Allowed state transitions. The defaults are the only ones the controller needs:
 * <pre>
 * ALL_SYNCED      -&gt; A_DIRTY | B_DIRTY
 * A_DIRTY         -&gt; SYNC_PROCESSING
 * B_DIRTY         -&gt; SYNC_PROCESSING
 * SYNC_PROCESSING -&gt; ALL_SYNCED | A_DIRTY | B_DIRTY
 * </pre>
 * Custom rules can only narrow what the controller does; a transition missing from them is refused.
 */
public final class StateTransitionRules {

    private static final StateTransitionRules DEFAULTS = builder()
            .allow(SyncState.ALL_SYNCED, SyncState.A_DIRTY, SyncState.B_DIRTY)
            .allow(SyncState.A_DIRTY, SyncState.SYNC_PROCESSING)
            .allow(SyncState.B_DIRTY, SyncState.SYNC_PROCESSING)
            .allow(SyncState.SYNC_PROCESSING, SyncState.ALL_SYNCED, SyncState.A_DIRTY, SyncState.B_DIRTY)
            .build();

    private final Map<SyncState, Set<SyncState>> allowed;

    private StateTransitionRules(Map<SyncState, Set<SyncState>> allowed) {
        this.allowed = allowed;
    }

    public static StateTransitionRules defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isAllowed(SyncState from, SyncState to) {
        return allowed.getOrDefault(from, Set.of()).contains(to);
    }

    public Set<SyncState> targetsFrom(SyncState from) {
        return allowed.getOrDefault(from, Set.of());
    }

    @Override
    public String toString() {
        return "StateTransitionRules" + allowed;
    }

    public static final class Builder {
        private final Map<SyncState, Set<SyncState>> allowed = new EnumMap<>(SyncState.class);

        private Builder() {
        }

        public Builder allow(SyncState from, SyncState... targets) {
            Objects.requireNonNull(from, "from");
            Set<SyncState> set = allowed.computeIfAbsent(from, k -> EnumSet.noneOf(SyncState.class));
            for (SyncState t : targets) {
                set.add(Objects.requireNonNull(t, "target"));
            }
            return this;
        }

        public StateTransitionRules build() {
            Map<SyncState, Set<SyncState>> copy = new EnumMap<>(SyncState.class);
            allowed.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(EnumSet.copyOf(v))));
            return new StateTransitionRules(Collections.unmodifiableMap(copy));
        }
    }
}
