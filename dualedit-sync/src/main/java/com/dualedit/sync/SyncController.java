package com.dualedit.sync;

import com.dualedit.timing.Cancellable;
import com.dualedit.timing.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * State machine deciding which representation is authoritative. One instance per editing session.
 * <p>
 * Edits make a side dirty; {@link #triggerSync()} moves to {@link SyncState#SYNC_PROCESSING}, which ends in
 * {@link #handleSyncSuccess()} or {@link #handleSyncFailed(String, String, boolean)}, or in a
 * {@code SYNC_TIMEOUT} failure when neither arrives within the configured timeout. A failed sync always
 * returns to the dirty state it started from, so nothing the user typed is lost; the failure's
 * {@link RecoveryAction} tells the owner whether the other representations must be restored from the last
 * synced snapshot. Requests that do not fit the current state are refused by returning {@code false}.
 * <p>
 * Not thread-safe: all calls, including the timeout and retry tasks, must run on the scheduler's thread.
 */
public final class SyncController {

    private static final Logger log = LoggerFactory.getLogger(SyncController.class);

    private final Scheduler scheduler;
    private final SyncControllerOptions options;
    private final PendingEditQueue pendingEdits;
    private final Deque<VersionMetadata> versions = new ArrayDeque<>();
    private final List<StateChangeListener> stateChangeListeners = new CopyOnWriteArrayList<>();
    private final List<SyncFailedListener> syncFailedListeners = new CopyOnWriteArrayList<>();
    private final List<PendingEditRejectedListener> pendingEditRejectedListeners = new CopyOnWriteArrayList<>();

    private SyncState state = SyncState.ALL_SYNCED;
    private StateTransitionRules rules = StateTransitionRules.defaults();
    private EditSide lastDirtySide;
    private Cancellable timeout;
    private Cancellable retry;
    private int retriesUsed;
    private int nextVersion;
    private long editSequence;
    private boolean replaying;

    public SyncController(Scheduler scheduler) {
        this(scheduler, SyncControllerOptions.defaults());
    }

    public SyncController(Scheduler scheduler, SyncControllerOptions options) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.options = Objects.requireNonNull(options, "options");
        this.pendingEdits = new PendingEditQueue(options.getPendingQueueCapacity());
        recordVersion("initialize");
    }

    /**
     * Puts the controller into {@code initialState} with {@code rules} (defaults when null), dropping pending
     * edits, version history and any running timeout. Listeners are kept and told about the state change.
     */
    public void initialize(SyncState initialState, StateTransitionRules rules) {
        Objects.requireNonNull(initialState, "initialState");
        cancelTimers();
        pendingEdits.clear();
        versions.clear();
        nextVersion = 0;
        retriesUsed = 0;
        lastDirtySide = null;
        this.rules = rules != null ? rules : StateTransitionRules.defaults();
        SyncState previous = state;
        state = initialState;
        if (initialState == SyncState.ALL_SYNCED) {
            recordVersion("initialize");
        } else if (initialState == SyncState.SYNC_PROCESSING) {
            startTimeout();
        }
        log.debug("Initialized in {}", initialState);
        if (previous != initialState) {
            notifyStateChange(previous, initialState);
        }
    }

    /** Same as {@code initialize(ALL_SYNCED, null)}. */
    public void reset() {
        initialize(SyncState.ALL_SYNCED, null);
    }

    public SyncState getCurrentState() {
        return state;
    }

    public Optional<EditSide> getLastDirtySide() {
        return Optional.ofNullable(lastDirtySide);
    }

    public EditPermissions getEditPermissions() {
        return EditPermissions.of(state, lastDirtySide);
    }

    public SyncControllerOptions getOptions() {
        return options;
    }

    /**
     * Moves to {@code target} if the rules allow it. Entering {@link SyncState#SYNC_PROCESSING} from a dirty
     * state remembers that side and starts the timeout.
     *
     * @return false, with no effect, when the transition is not allowed
     */
    public boolean tryTransition(SyncState target) {
        Objects.requireNonNull(target, "target");
        if (!rules.isAllowed(state, target)) {
            log.debug("Refused transition {} -> {}", state, target);
            return false;
        }
        if (target == SyncState.SYNC_PROCESSING) {
            lastDirtySide = state.dirtySide();
        } else if (state == SyncState.SYNC_PROCESSING) {
            lastDirtySide = null;
        }
        changeState(target);
        return true;
    }

    public EditOutcome handleEditA() {
        return handleEdit(EditSide.A);
    }

    public EditOutcome handleEditB() {
        return handleEdit(EditSide.B);
    }

    public EditOutcome handleEdit(EditSide side) {
        Objects.requireNonNull(side, "side");
        if (state == SyncState.SYNC_PROCESSING) {
            pendingEdits.offer(new PendingEdit(side, scheduler.currentTimeMillis(), editSequence++));
            return EditOutcome.QUEUED;
        }
        if (state == side.dirtyState()) {
            return EditOutcome.APPLIED;
        }
        if (state == SyncState.ALL_SYNCED && tryTransition(side.dirtyState())) {
            return EditOutcome.APPLIED;
        }
        if (!replaying) {
            log.warn("Edit on side {} rejected in state {}", side, state);
        }
        return EditOutcome.REJECTED;
    }

    /**
     * Starts a sync from the dirty side.
     *
     * @return false when there is nothing to sync (not in a dirty state)
     */
    public boolean triggerSync() {
        cancelRetry();
        retriesUsed = 0;
        return startSync();
    }

    private boolean startSync() {
        if (!state.isDirty()) {
            return false;
        }
        return tryTransition(SyncState.SYNC_PROCESSING);
    }

    /**
     * Completes the running sync: records a new version, then replays edits queued meanwhile in arrival order.
     *
     * @return false when no sync is running
     */
    public boolean handleSyncSuccess() {
        if (state != SyncState.SYNC_PROCESSING) {
            return false;
        }
        EditSide from = lastDirtySide;
        retriesUsed = 0;
        if (!tryTransition(SyncState.ALL_SYNCED)) {
            return false;
        }
        recordVersion(from != null ? "sync from " + from : "sync");
        replayPendingEdits();
        return true;
    }

    public boolean handleSyncFailed(String message) {
        return handleSyncFailed(message, ErrorType.UNKNOWN.name(), false);
    }

    public boolean handleSyncFailed(String message, ErrorType type) {
        return handleSyncFailed(message, type.name(), false);
    }

    /**
     * Fails the running sync. Sync-failed listeners are notified first, then the controller returns to the
     * dirty state the sync started from ({@link SyncState#ALL_SYNCED} if unknown). An {@code UNKNOWN}-class
     * failure schedules one retry of the sync after the retry delay unless {@code skipRetry}.
     *
     * @param code an {@link ErrorType} name; anything else counts as {@link ErrorType#UNKNOWN}
     * @return false when no sync is running
     */
    public boolean handleSyncFailed(String message, String code, boolean skipRetry) {
        if (state != SyncState.SYNC_PROCESSING) {
            return false;
        }
        ErrorClassification classification = ErrorType.fromCode(code).classification();
        EditSide from = lastDirtySide;
        SyncState target = from != null ? from.dirtyState() : SyncState.ALL_SYNCED;
        boolean retrying = !skipRetry && from != null && retriesUsed < classification.maxRetries();

        cancelTimeout();
        notifySyncFailed(new SyncFailedEvent(message, code, classification, state, target, from,
                classification.recoveryAction(), retrying));
        if (state != SyncState.SYNC_PROCESSING) {
            // a listener already moved the controller on (rollback, reset)
            return true;
        }
        if (!tryTransition(target)) {
            log.warn("Rules refused recovery transition to {}; forcing it", target);
            lastDirtySide = null;
            changeState(target);
        }
        if (retrying) {
            retriesUsed++;
            log.debug("Retrying sync from {} in {} ms (attempt {})", from, options.getRetryDelayMs(), retriesUsed);
            retry = scheduler.schedule(options.getRetryDelayMs(), () -> {
                retry = null;
                startSync();
            });
        }
        return true;
    }

    /**
     * Forces {@link SyncState#ALL_SYNCED} at a recorded version: pending edits are dropped and any running
     * sync is abandoned. The version history itself is kept.
     *
     * @param version the version to return to; null, or a version no longer in the history, means the latest
     * @return the version applied; empty when no version has been recorded
     */
    public Optional<VersionMetadata> rollbackToVersion(Integer version) {
        VersionMetadata target = null;
        if (version != null) {
            for (VersionMetadata v : versions) {
                if (v.version() == version) {
                    target = v;
                    break;
                }
            }
            if (target == null) {
                log.warn("Version {} is not in the history; rolling back to the latest", version);
            }
        }
        if (target == null) {
            target = versions.peekLast();
        }
        if (target == null) {
            return Optional.empty();
        }
        cancelTimers();
        pendingEdits.clear();
        retriesUsed = 0;
        lastDirtySide = null;
        log.info("Rolled back to version {} ({})", target.version(), target.reason());
        if (state != SyncState.ALL_SYNCED) {
            changeState(SyncState.ALL_SYNCED);
        }
        return Optional.of(target);
    }

    public Optional<VersionMetadata> getLatestVersion() {
        return Optional.ofNullable(versions.peekLast());
    }

    /** Oldest first. */
    public List<VersionMetadata> getVersionHistory() {
        return List.copyOf(versions);
    }

    public List<PendingEdit> getPendingEdits() {
        return pendingEdits.snapshot();
    }

    public int getPendingEditCount() {
        return pendingEdits.size();
    }

    /** @return a handle that removes the listener */
    public Runnable addStateChangeListener(StateChangeListener listener) {
        stateChangeListeners.add(Objects.requireNonNull(listener, "listener"));
        return () -> stateChangeListeners.remove(listener);
    }

    public boolean removeStateChangeListener(StateChangeListener listener) {
        return stateChangeListeners.remove(listener);
    }

    /** @return a handle that removes the listener */
    public Runnable addSyncFailedListener(SyncFailedListener listener) {
        syncFailedListeners.add(Objects.requireNonNull(listener, "listener"));
        return () -> syncFailedListeners.remove(listener);
    }

    public boolean removeSyncFailedListener(SyncFailedListener listener) {
        return syncFailedListeners.remove(listener);
    }

    /** @return a handle that removes the listener */
    public Runnable addPendingEditRejectedListener(PendingEditRejectedListener listener) {
        pendingEditRejectedListeners.add(Objects.requireNonNull(listener, "listener"));
        return () -> pendingEditRejectedListeners.remove(listener);
    }

    private void replayPendingEdits() {
        List<PendingEdit> edits = pendingEdits.drain();
        if (edits.isEmpty()) {
            return;
        }
        log.debug("Replaying {} pending edit(s)", edits.size());
        replaying = true;
        try {
            for (PendingEdit edit : edits) {
                if (handleEdit(edit.side()) == EditOutcome.REJECTED) {
                    notifyPendingEditRejected(edit);
                }
            }
        } finally {
            replaying = false;
        }
    }

    private void changeState(SyncState target) {
        SyncState previous = state;
        if (previous == target) {
            return;
        }
        state = target;
        if (previous == SyncState.SYNC_PROCESSING) {
            cancelTimeout();
        }
        if (target == SyncState.SYNC_PROCESSING) {
            startTimeout();
        }
        log.debug("State {} -> {}", previous, target);
        notifyStateChange(previous, target);
    }

    private void startTimeout() {
        cancelTimeout();
        long timeoutMs = options.getSyncTimeoutMs();
        Cancellable[] handle = new Cancellable[1];
        handle[0] = scheduler.schedule(timeoutMs, () -> {
            if (timeout != handle[0] || state != SyncState.SYNC_PROCESSING) {
                return;
            }
            timeout = null;
            log.warn("Sync from {} timed out after {} ms", lastDirtySide, timeoutMs);
            handleSyncFailed("Sync timed out after " + timeoutMs + " ms", ErrorType.SYNC_TIMEOUT.name(), true);
        });
        timeout = handle[0];
        log.debug("Sync timeout armed for {} ms", timeoutMs);
    }

    private void cancelTimeout() {
        if (timeout != null) {
            timeout.cancel();
            timeout = null;
            log.debug("Sync timeout cancelled");
        }
    }

    private void cancelRetry() {
        if (retry != null) {
            retry.cancel();
            retry = null;
        }
    }

    private void cancelTimers() {
        cancelTimeout();
        cancelRetry();
    }

    private void recordVersion(String reason) {
        versions.addLast(new VersionMetadata(nextVersion++, scheduler.currentTimeMillis(), SyncState.ALL_SYNCED, reason));
        while (versions.size() > options.getVersionHistoryLimit()) {
            versions.removeFirst();
        }
    }

    private void notifyStateChange(SyncState from, SyncState to) {
        for (StateChangeListener l : stateChangeListeners) {
            try {
                l.onStateChange(from, to);
            } catch (RuntimeException e) {
                log.warn("State change listener failed on {} -> {}; continuing", from, to, e);
            }
        }
    }

    private void notifySyncFailed(SyncFailedEvent event) {
        for (SyncFailedListener l : syncFailedListeners) {
            try {
                l.onSyncFailed(event);
            } catch (RuntimeException e) {
                log.warn("Sync failed listener threw for {}; continuing", event.errorCode(), e);
            }
        }
    }

    private void notifyPendingEditRejected(PendingEdit edit) {
        for (PendingEditRejectedListener l : pendingEditRejectedListeners) {
            try {
                l.onPendingEditRejected(edit);
            } catch (RuntimeException e) {
                log.warn("Pending edit rejected listener threw for {}; continuing", edit, e);
            }
        }
    }

    @Override
    public String toString() {
        return "SyncController{state=" + state + ", lastDirtySide=" + lastDirtySide
                + ", pending=" + pendingEdits.size() + "}";
    }
}
