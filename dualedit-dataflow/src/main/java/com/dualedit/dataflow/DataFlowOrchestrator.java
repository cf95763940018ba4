package com.dualedit.dataflow;

import com.dualedit.config.DualEditConfig;
import com.dualedit.expression.ExpressionTransformer;
import com.dualedit.expression.ast.IntermediateNode;
import com.dualedit.expression.ast.IntermediateNodes;
import com.dualedit.expression.text.ParseResult;
import com.dualedit.expression.validation.ValidationResult;
import com.dualedit.expression.visual.ConversionResult;
import com.dualedit.expression.visual.VisualNode;
import com.dualedit.mapping.Mapping;
import com.dualedit.mapping.Position;
import com.dualedit.mapping.PositionMapper;
import com.dualedit.sync.EditOutcome;
import com.dualedit.sync.EditSide;
import com.dualedit.sync.ErrorType;
import com.dualedit.sync.PendingEdit;
import com.dualedit.sync.RecoveryAction;
import com.dualedit.sync.SyncController;
import com.dualedit.sync.SyncControllerOptions;
import com.dualedit.sync.SyncFailedEvent;
import com.dualedit.sync.SyncState;
import com.dualedit.sync.VersionMetadata;
import com.dualedit.timing.Scheduler;
import com.dualedit.timing.TimingController;
import com.dualedit.timing.TimingManager;
import com.dualedit.timing.TimingMode;
import com.dualedit.timing.TimingOptions;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Keeps the visual tree, the intermediate tree and the text of one expression in step.
 * <p>
 * Editor collaborators report edits through {@link #onVisualEdited(VisualNode)} (side A) and
 * {@link #onTextEdited(String)} (side B). Each accepted edit restarts a debounce; when the user pauses, the
 * {@link SyncController} enters {@link SyncState#SYNC_PROCESSING} and the orchestrator regenerates the other
 * side from the dirty one on the next scheduler turn. A successful sync commits a new
 * {@link RepresentationSnapshot}; a failed one leaves the dirty side's draft untouched and every other
 * representation at the last committed snapshot.
 * <p>
 * Edits made while a sync runs are queued by the controller; the latest payload per side is kept here and
 * re-applied when the controller replays the queue. Edits arriving while a committed snapshot is being
 * published to listeners are treated as echoes of that snapshot and ignored.
 * <p>
 * Not thread-safe: every call must come from the scheduler's thread.
 */
public final class DataFlowOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DataFlowOrchestrator.class);

    static final String SYNC_TRIGGER_ID = "sync-trigger";

    private final Scheduler scheduler;
    private final DualEditConfig config;
    private final ExpressionTransformer transformer;
    private final PositionMapper mapper;
    private final SyncController controller;
    private final TimingManager timing;
    private final TimingController<EditSide> syncTrigger;
    private final SyncMetrics metrics;
    private final List<DataFlowListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> subscriptions = new ArrayList<>();
    private final Map<Integer, RepresentationSnapshot> history;
    private final Map<EditSide, Object> queuedPayloads = new EnumMap<>(EditSide.class);

    private RepresentationSnapshot stable;
    private VisualNode visualDraft;
    private String textDraft;
    private SyncFailedEvent lastFailure;
    private boolean applyingSync;
    private boolean closed;

    public DataFlowOrchestrator(Scheduler scheduler) {
        this(scheduler, DualEditConfig.defaults(), new ExpressionTransformer(), null);
    }

    public DataFlowOrchestrator(Scheduler scheduler, DualEditConfig config) {
        this(scheduler, config, new ExpressionTransformer(), null);
    }

    /**
     * @param registry where sync meters are registered; null means a private registry. Ignored when the
     *                 config has {@code metricsEnabled=false}
     */
    public DataFlowOrchestrator(Scheduler scheduler, DualEditConfig config, ExpressionTransformer transformer,
                                MeterRegistry registry) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.config = Objects.requireNonNull(config, "config");
        this.transformer = Objects.requireNonNull(transformer, "transformer");
        this.mapper = new PositionMapper();
        this.metrics = config.isMetricsEnabled() ? SyncMetrics.using(registry) : SyncMetrics.disabled();
        this.controller = new SyncController(scheduler, SyncControllerOptions.builder()
                .syncTimeoutMs(config.getSyncTimeoutMs())
                .retryDelayMs(config.getRetryDelayMs())
                .pendingQueueCapacity(config.getPendingQueueCapacity())
                .versionHistoryLimit(config.getVersionHistoryLimit())
                .build());
        this.timing = new TimingManager(scheduler);
        this.syncTrigger = timing.createDebounce(SYNC_TRIGGER_ID, this::onQuietPeriod,
                TimingOptions.builder(TimingMode.DEBOUNCE)
                        .delayMillis(config.getDebounceMs())
                        .leading(config.isDebounceLeading())
                        .trailing(true)
                        .build());

        int historyLimit = config.getVersionHistoryLimit();
        this.history = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Integer, RepresentationSnapshot> eldest) {
                return size() > historyLimit;
            }
        };
        this.stable = RepresentationSnapshot.initial(scheduler.currentTimeMillis());
        this.textDraft = stable.text();
        history.put(stable.version(), stable);

        subscriptions.add(controller.addStateChangeListener(this::onStateChange));
        subscriptions.add(controller.addSyncFailedListener(this::onSyncFailed));
        subscriptions.add(controller.addPendingEditRejectedListener(this::onPendingEditRejected));
        log.info("Data flow orchestrator started: debounce={} ms, syncTimeout={} ms, metrics={}",
                config.getDebounceMs(), config.getSyncTimeoutMs(), metrics.isEnabled());
    }

    // ---- edits ---------------------------------------------------------------------------------------------

    /** The visual editor changed; {@code visual} is its whole tree (null when the workspace is empty). */
    public EditOutcome onVisualEdited(VisualNode visual) {
        return onEdited(EditSide.A, visual);
    }

    /** The text editor changed; {@code text} is its whole content. */
    public EditOutcome onTextEdited(String text) {
        return onEdited(EditSide.B, text == null ? "" : text);
    }

    private EditOutcome onEdited(EditSide side, Object payload) {
        if (closed) {
            log.warn("Edit on side {} after close ignored", side);
            return EditOutcome.REJECTED;
        }
        if (applyingSync) {
            log.debug("Ignoring edit on side {} while a synced snapshot is applied", side);
            return EditOutcome.REJECTED;
        }
        EditOutcome outcome = controller.handleEdit(side);
        switch (outcome) {
            case APPLIED:
                setDraft(side, payload);
                syncTrigger.execute(side);
                break;
            case QUEUED:
                queuedPayloads.put(side, payload);
                break;
            case REJECTED:
                metrics.recordRejected(side);
                notifyListeners(l -> l.onEditRejected(side), "edit rejected");
                break;
            default:
                throw new IllegalStateException("Unexpected outcome " + outcome);
        }
        return outcome;
    }

    private void onQuietPeriod(EditSide side) {
        if (controller.getCurrentState() == side.dirtyState()) {
            controller.triggerSync();
        }
    }

    // ---- sync ----------------------------------------------------------------------------------------------

    private void onStateChange(SyncState from, SyncState to) {
        if (to == SyncState.SYNC_PROCESSING) {
            scheduler.submit(this::performSync);
        } else if (to.isDirty()) {
            adoptQueuedPayload(to.dirtySide());
        }
    }

    /** A replayed edit became the new dirty side: its latest payload becomes the draft. */
    private void adoptQueuedPayload(EditSide side) {
        if (!queuedPayloads.containsKey(side)) {
            return;
        }
        setDraft(side, queuedPayloads.remove(side));
        syncTrigger.execute(side);
    }

    private void onPendingEditRejected(PendingEdit edit) {
        if (queuedPayloads.containsKey(edit.side())) {
            queuedPayloads.remove(edit.side());
            log.info("Discarded edit on side {} queued during sync; side {} is now authoritative",
                    edit.side(), edit.side().other());
            metrics.recordRejected(edit.side());
            notifyListeners(l -> l.onEditRejected(edit.side()), "edit rejected");
        }
    }

    private void performSync() {
        if (closed || controller.getCurrentState() != SyncState.SYNC_PROCESSING) {
            return;
        }
        Optional<EditSide> dirty = controller.getLastDirtySide();
        if (dirty.isEmpty()) {
            controller.handleSyncFailed("No dirty side to sync from", ErrorType.RUNTIME_ERROR.name(), true);
            return;
        }
        EditSide side = dirty.get();
        long started = System.nanoTime();
        Attempt attempt;
        try {
            attempt = side == EditSide.A ? syncFromVisual() : syncFromText();
        } catch (RuntimeException e) {
            log.error("Sync from {} failed unexpectedly", side, e);
            attempt = Attempt.failed(ErrorType.RUNTIME_ERROR, String.valueOf(e.getMessage()));
        } catch (StackOverflowError e) {
            log.error("Sync from {} ran out of stack", side, e);
            attempt = Attempt.failed(ErrorType.RESOURCE_EXHAUSTION, "Expression is too deeply nested to transform");
        }
        long elapsed = System.nanoTime() - started;
        if (attempt.snapshot == null) {
            metrics.recordFailedAttempt(side, elapsed);
            controller.handleSyncFailed(attempt.message, attempt.errorType.name(), true);
            return;
        }
        if (commit(attempt.snapshot, side)) {
            metrics.recordSuccess(side, elapsed);
        }
    }

    private Attempt syncFromVisual() {
        VisualNode visual = visualDraft;
        if (visual == null) {
            return Attempt.ok(snapshot(null, null, "", Mapping.empty(), EditSide.A));
        }
        ConversionResult<IntermediateNode> converted = transformer.visualToIntermediate(visual);
        IntermediateNode node = converted.node();
        Attempt invalid = validate(node);
        if (invalid != null) {
            return invalid;
        }
        String text = transformer.intermediateToText(node);
        return Attempt.ok(snapshot(visual, node, text, mapper.createMapping(node, text), EditSide.A));
    }

    private Attempt syncFromText() {
        String text = textDraft;
        if (text.isBlank()) {
            return Attempt.ok(snapshot(null, null, text, Mapping.empty(), EditSide.B));
        }
        ParseResult<IntermediateNode> parsed = transformer.textToIntermediate(text);
        if (!parsed.isSuccess()) {
            return Attempt.failed(ErrorType.SYNTAX_ERROR, parsed.getError().toString());
        }
        IntermediateNode node = parsed.getNode();
        Attempt invalid = validate(node);
        if (invalid != null) {
            return invalid;
        }
        VisualNode visual = transformer.intermediateToVisual(node);
        return Attempt.ok(snapshot(visual, node, text, mapper.createMapping(node, text), EditSide.B));
    }

    private Attempt validate(IntermediateNode node) {
        if (!config.isValidateOnSync()) {
            return null;
        }
        ValidationResult result = transformer.validate(node);
        return result.isValid() ? null : Attempt.failed(ErrorType.VALIDATION_ERROR, result.firstError());
    }

    private RepresentationSnapshot snapshot(VisualNode visual, IntermediateNode node, String text, Mapping mapping,
                                            EditSide source) {
        return new RepresentationSnapshot(visual, node, text, mapping, stable.version(),
                scheduler.currentTimeMillis(), source);
    }

    private boolean commit(RepresentationSnapshot snapshot, EditSide side) {
        if (controller.getCurrentState() != SyncState.SYNC_PROCESSING) {
            log.warn("Sync from {} finished after the controller left SYNC_PROCESSING; result dropped", side);
            return false;
        }
        applyingSync = true;
        try {
            applySnapshot(snapshot);
            controller.handleSyncSuccess();
            int version = controller.getLatestVersion().map(VersionMetadata::version).orElse(snapshot.version());
            stable = snapshot.withVersion(version);
            history.put(version, stable);
            lastFailure = null;
            log.info("Synced from {} at version {} ({} nodes)", side, version,
                    stable.isEmpty() ? 0 : IntermediateNodes.count(stable.intermediate()));
            RepresentationSnapshot committed = stable;
            notifyListeners(l -> l.onSnapshotCommitted(committed), "snapshot committed");
        } finally {
            applyingSync = false;
        }
        return true;
    }

    /** Makes {@code snapshot} current; replay during the success call may still replace one side's draft. */
    private void applySnapshot(RepresentationSnapshot snapshot) {
        stable = snapshot;
        visualDraft = snapshot.visual();
        textDraft = snapshot.text();
    }

    private void onSyncFailed(SyncFailedEvent event) {
        lastFailure = event;
        metrics.recordFailure(event);
        log.warn("Sync from {} failed with {} ({}): {}", event.attemptedSyncFrom(), event.errorCode(),
                event.classification(), event.errorMessage());
        if (event.recovery() == RecoveryAction.ROLLBACK_TO_STABLE && event.attemptedSyncFrom() != null) {
            restoreFromStable(event.attemptedSyncFrom().other());
        }
        notifyListeners(l -> l.onSyncFailed(event), "sync failed");
    }

    private void restoreFromStable(EditSide side) {
        log.debug("Restoring side {} from version {}", side, stable.version());
        if (side == EditSide.A) {
            visualDraft = stable.visual();
        } else {
            textDraft = stable.text();
        }
    }

    // ---- operations ----------------------------------------------------------------------------------------

    /**
     * Replaces all representations with ones generated from {@code intermediate}, as if the visual editor had
     * produced it. Only possible while everything is synced.
     *
     * @return whether the new snapshot was committed
     */
    public boolean updateFromIntermediate(IntermediateNode intermediate) {
        if (closed || controller.getCurrentState() != SyncState.ALL_SYNCED) {
            log.warn("Cannot inject a tree in state {}", controller.getCurrentState());
            return false;
        }
        controller.handleEdit(EditSide.A);
        visualDraft = intermediate == null ? null : transformer.intermediateToVisual(intermediate);
        syncTrigger.cancel();
        controller.triggerSync();
        int before = stable.version();
        performSync();
        return stable.version() != before;
    }

    /**
     * Regenerates {@code target} from the other side now, skipping the rest of the quiet period.
     *
     * @return whether a sync ran and succeeded
     */
    public boolean forceSyncTo(EditSide target) {
        EditSide source = Objects.requireNonNull(target, "target").other();
        SyncState state = controller.getCurrentState();
        if (state == source.dirtyState()) {
            syncTrigger.cancel();
            controller.triggerSync();
        } else if (state != SyncState.SYNC_PROCESSING
                || controller.getLastDirtySide().filter(source::equals).isEmpty()) {
            log.debug("Nothing to sync towards {} in state {}", target, state);
            return false;
        }
        int before = stable.version();
        performSync();
        return controller.getCurrentState() != SyncState.SYNC_PROCESSING && stable.version() != before;
    }

    /**
     * Re-derives each representation of the committed snapshot from the others and reports disagreements,
     * plus any unsynced edits. Conflicts are also published to listeners.
     */
    public SyncStatusReport checkSyncStatus() {
        List<String> conflicts = new ArrayList<>();
        SyncState state = controller.getCurrentState();
        if (state.isDirty()) {
            conflicts.add("Side " + state.dirtySide() + " has unsynced edits");
        } else if (state == SyncState.SYNC_PROCESSING) {
            conflicts.add("A sync is in progress");
        }
        RepresentationSnapshot current = stable;
        if (current.isEmpty()) {
            if (current.visual() != null) {
                conflicts.add("Visual tree present but no intermediate tree");
            }
        } else {
            IntermediateNode fromVisual = current.visual() == null ? null
                    : transformer.visualToIntermediate(current.visual()).node();
            ParseResult<IntermediateNode> fromText = transformer.textToIntermediate(current.text());
            if (fromVisual == null) {
                conflicts.add("Visual tree missing");
            } else if (!IntermediateNodes.equivalent(fromVisual, current.intermediate())) {
                conflicts.add("Visual tree differs from the intermediate tree");
            }
            if (!fromText.isSuccess()) {
                conflicts.add("Text does not parse: " + fromText.getError());
            } else if (!IntermediateNodes.equivalent(fromText.getNode(), current.intermediate())) {
                conflicts.add("Text differs from the intermediate tree");
            }
        }
        SyncStatusReport report = SyncStatusReport.of(conflicts);
        if (!report.inSync()) {
            notifyListeners(l -> l.onConflict(report), "conflict");
        }
        return report;
    }

    /**
     * Returns every representation to a committed version, dropping drafts, queued edits and any running
     * sync. The controller falls back to its latest version when {@code version} is null or unknown.
     *
     * @return the snapshot now current; empty when no version could be restored
     */
    public Optional<RepresentationSnapshot> rollbackToVersion(Integer version) {
        Optional<VersionMetadata> applied = controller.rollbackToVersion(version);
        if (applied.isEmpty()) {
            return Optional.empty();
        }
        syncTrigger.cancel();
        queuedPayloads.clear();
        RepresentationSnapshot target = history.get(applied.get().version());
        if (target == null) {
            log.warn("No snapshot kept for version {}; keeping version {}", applied.get().version(), stable.version());
            target = stable;
        }
        applyingSync = true;
        try {
            applySnapshot(target);
            RepresentationSnapshot restored = target;
            notifyListeners(l -> l.onSnapshotCommitted(restored), "snapshot committed");
        } finally {
            applyingSync = false;
        }
        return Optional.of(target);
    }

    /** Node under a text offset of the committed text; empty while a sync runs. */
    public Optional<String> findNodeAt(int offset) {
        if (controller.getCurrentState() == SyncState.SYNC_PROCESSING) {
            return Optional.empty();
        }
        return mapper.findElementByPosition(offset, stable.mapping());
    }

    /** Text range of a node in the committed text; empty while a sync runs. */
    public Optional<Position> findRangeOf(String nodeId) {
        if (controller.getCurrentState() == SyncState.SYNC_PROCESSING) {
            return Optional.empty();
        }
        return mapper.findPositionByElement(nodeId, stable.mapping());
    }

    /** Outermost nodes inside a text selection of the committed text. */
    public List<String> findNodesInRange(Position selection) {
        if (controller.getCurrentState() == SyncState.SYNC_PROCESSING) {
            return List.of();
        }
        return mapper.findElementsInRange(selection, stable.mapping());
    }

    /** Committed expression printed with minimal parentheses; empty when there is none. */
    public Optional<String> getFormattedText() {
        if (stable.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(transformer.intermediateToText(transformer.format(stable.intermediate())));
    }

    public RepresentationSnapshot getSnapshot() {
        return stable;
    }

    public VisualNode getVisualDraft() {
        return visualDraft;
    }

    public String getTextDraft() {
        return textDraft;
    }

    public SyncState getState() {
        return controller.getCurrentState();
    }

    public Optional<SyncFailedEvent> getLastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    public List<VersionMetadata> getVersionHistory() {
        return controller.getVersionHistory();
    }

    public SyncMetrics getMetrics() {
        return metrics;
    }

    /** The underlying state machine, for permission queries. */
    public SyncController getSyncController() {
        return controller;
    }

    /** @return a handle that removes the listener */
    public Runnable addListener(DataFlowListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return () -> listeners.remove(listener);
    }

    /** Cancels timers and detaches from the controller. Later edits are rejected. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        timing.destroy();
        subscriptions.forEach(Runnable::run);
        subscriptions.clear();
        listeners.clear();
        queuedPayloads.clear();
        log.info("Data flow orchestrator closed at version {}", stable.version());
    }

    private void setDraft(EditSide side, Object payload) {
        if (side == EditSide.A) {
            visualDraft = (VisualNode) payload;
        } else {
            textDraft = (String) payload;
        }
    }

    private void notifyListeners(Consumer<DataFlowListener> call, String what) {
        for (DataFlowListener l : listeners) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                log.warn("Data flow listener failed on {}; continuing", what, e);
            }
        }
    }

    /** Outcome of one regeneration: a snapshot, or the error to fail the sync with. */
    private static final class Attempt {
        private final RepresentationSnapshot snapshot;
        private final ErrorType errorType;
        private final String message;

        private Attempt(RepresentationSnapshot snapshot, ErrorType errorType, String message) {
            this.snapshot = snapshot;
            this.errorType = errorType;
            this.message = message;
        }

        static Attempt ok(RepresentationSnapshot snapshot) {
            return new Attempt(snapshot, null, null);
        }

        static Attempt failed(ErrorType errorType, String message) {
            return new Attempt(null, errorType, message);
        }
    }
}
