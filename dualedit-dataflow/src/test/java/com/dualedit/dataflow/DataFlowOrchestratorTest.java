package com.dualedit.dataflow;

import com.dualedit.config.DualEditConfig;
import com.dualedit.expression.ExpressionTransformer;
import com.dualedit.expression.ast.IntermediateNodes;
import com.dualedit.expression.text.ExpressionParser;
import com.dualedit.expression.visual.VisualNode;
import com.dualedit.expression.visual.VisualNodeJson;
import com.dualedit.expression.visual.VisualNodeKind;
import com.dualedit.mapping.Position;
import com.dualedit.sync.EditOutcome;
import com.dualedit.sync.EditSide;
import com.dualedit.sync.ErrorClassification;
import com.dualedit.sync.ErrorType;
import com.dualedit.sync.SyncFailedEvent;
import com.dualedit.sync.SyncState;
import com.dualedit.timing.VirtualScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataFlowOrchestratorTest {

    private static final String AGE_CHECK = """
            {
              "kind": "logic_compare", "id": "c1", "fields": { "OP": "GT" },
              "slots": {
                "A": { "kind": "math_variable", "id": "v2", "fields": { "VAR": "age" } },
                "B": { "kind": "math_number", "id": "n1", "fields": { "NUM": 18 } }
              }
            }
            """;

    private VirtualScheduler scheduler;
    private SimpleMeterRegistry registry;
    private DataFlowOrchestrator orchestrator;
    private RecordingListener events;

    @BeforeEach
    void setUp() {
        scheduler = new VirtualScheduler();
        registry = new SimpleMeterRegistry();
        orchestrator = create(DualEditConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    private DataFlowOrchestrator create(DualEditConfig config) {
        DataFlowOrchestrator o = new DataFlowOrchestrator(scheduler, config, new ExpressionTransformer(), registry);
        events = new RecordingListener();
        o.addListener(events);
        return o;
    }

    private void syncText(String text) {
        orchestrator.onTextEdited(text);
        scheduler.advanceBy(300);
    }

    @Test
    void textEdit_regeneratesVisualAfterQuietPeriod() {
        assertEquals(EditOutcome.APPLIED, orchestrator.onTextEdited("a + b * 2"));
        assertEquals(SyncState.B_DIRTY, orchestrator.getState());

        scheduler.advanceBy(299);
        assertEquals(SyncState.B_DIRTY, orchestrator.getState());
        assertNull(orchestrator.getSnapshot().visual());

        scheduler.advanceBy(1);
        RepresentationSnapshot snapshot = orchestrator.getSnapshot();
        assertEquals(SyncState.ALL_SYNCED, orchestrator.getState());
        assertEquals("a + b * 2", snapshot.text());
        assertNotNull(snapshot.visual());
        assertEquals(1, snapshot.version());
        assertEquals(EditSide.B, snapshot.source());
        assertTrue(IntermediateNodes.equivalent(new ExpressionParser().parse("a + b * 2").getNode(),
                snapshot.intermediate()));
        assertEquals(List.of(snapshot), events.committed);
        assertEquals(2, orchestrator.getVersionHistory().size());
    }

    @Test
    void visualEdit_regeneratesTextAndMapping() {
        orchestrator.onVisualEdited(VisualNodeJson.fromJson(AGE_CHECK));
        scheduler.advanceBy(300);

        assertEquals(SyncState.ALL_SYNCED, orchestrator.getState());
        assertEquals("age > 18", orchestrator.getSnapshot().text());
        assertEquals("age > 18", orchestrator.getTextDraft());
        assertEquals(Optional.of("v2"), orchestrator.findNodeAt(1));
        assertEquals(Optional.of(new Position(0, 3)), orchestrator.findRangeOf("v2"));
        assertEquals(Optional.of(new Position(0, 8)), orchestrator.findRangeOf("c1"));
        assertEquals(List.of("c1"), orchestrator.findNodesInRange(new Position(0, 8)));
    }

    @Test
    void burstOfEdits_syncsOnlyTheLatestText() {
        orchestrator.onTextEdited("a");
        scheduler.advanceBy(100);
        orchestrator.onTextEdited("a +");
        scheduler.advanceBy(100);
        orchestrator.onTextEdited("a + 1");
        scheduler.advanceBy(300);

        assertEquals("a + 1", orchestrator.getSnapshot().text());
        assertEquals(1, events.committed.size());
        assertTrue(events.failures.isEmpty());
    }

    @Test
    void leadingDebounce_syncsFirstEditOnNextTurn() {
        orchestrator.close();
        orchestrator = create(DualEditConfig.builder().debounceLeading(true).build());

        orchestrator.onTextEdited("x * 2");
        scheduler.advanceBy(0);

        assertEquals(SyncState.ALL_SYNCED, orchestrator.getState());
        assertEquals("x * 2", orchestrator.getSnapshot().text());
    }

    @Test
    void syntaxError_keepsTextDirtyAndLeavesSnapshotAlone() {
        syncText("n + 1");
        RepresentationSnapshot before = orchestrator.getSnapshot();

        syncText("n +");

        assertEquals(SyncState.B_DIRTY, orchestrator.getState());
        assertEquals("n +", orchestrator.getTextDraft());
        assertEquals(before, orchestrator.getSnapshot());
        SyncFailedEvent failure = orchestrator.getLastFailure().orElseThrow();
        assertEquals(ErrorType.SYNTAX_ERROR, failure.errorType());
        assertEquals(ErrorClassification.DATA, failure.classification());
        assertEquals(EditSide.B, failure.attemptedSyncFrom());
        assertFalse(failure.retryScheduled());
        assertEquals(List.of(failure), events.failures);
        assertEquals(1.0, registry.counter(SyncMetrics.SYNC_FAILURE,
                "errorCode", "SYNTAX_ERROR", "classification", "DATA").count());

        scheduler.advanceBy(10_000);
        assertEquals(SyncState.B_DIRTY, orchestrator.getState());
    }

    @Test
    void longOperatorRun_failsAsSyntaxErrorWithoutTimingOut() {
        syncText("1" + "+1".repeat(5000));

        assertEquals(SyncState.B_DIRTY, orchestrator.getState());
        SyncFailedEvent failure = orchestrator.getLastFailure().orElseThrow();
        assertEquals(ErrorType.SYNTAX_ERROR, failure.errorType());
        assertTrue(failure.errorMessage().contains("nested too deeply"));

        scheduler.advanceBy(10_000);
        assertEquals(List.of(failure), events.failures);
    }

    @Test
    void visualTreeTooDeepToTransform_failsWithoutRetry() {
        VisualNode deep = VisualNode.builder(VisualNodeKind.MATH_NUMBER).id("n").field("NUM", 1).build();
        for (int i = 0; i < 200_000; i++) {
            deep = VisualNode.builder(VisualNodeKind.MATH_NEGATE).id("neg" + i).slot("NUM", deep).build();
        }

        orchestrator.onVisualEdited(deep);
        scheduler.advanceBy(300);

        assertEquals(SyncState.A_DIRTY, orchestrator.getState());
        SyncFailedEvent failure = orchestrator.getLastFailure().orElseThrow();
        assertEquals(ErrorType.RESOURCE_EXHAUSTION, failure.errorType());
        assertFalse(failure.retryScheduled());
        assertTrue(orchestrator.getSnapshot().isEmpty());
    }

    @Test
    void fixingTheText_recoversFromSyntaxError() {
        syncText("n +");
        syncText("n + 2");

        assertEquals(SyncState.ALL_SYNCED, orchestrator.getState());
        assertEquals("n + 2", orchestrator.getSnapshot().text());
        assertTrue(orchestrator.getLastFailure().isEmpty());
    }

    @Test
    void validationError_failsSyncOnlyWhenValidationIsOn() {
        syncText("frobnicate(x) + 1");
        assertEquals(SyncState.B_DIRTY, orchestrator.getState());
        assertEquals(ErrorType.VALIDATION_ERROR, orchestrator.getLastFailure().orElseThrow().errorType());
        assertEquals("Unknown function 'frobnicate'", orchestrator.getLastFailure().get().errorMessage());

        orchestrator.close();
        orchestrator = create(DualEditConfig.builder().validateOnSync(false).build());
        syncText("frobnicate(x) + 1");
        assertEquals(SyncState.ALL_SYNCED, orchestrator.getState());
    }

    @Test
    void editOnOtherSide_isRejectedWhileFirstSideIsDirty() {
        orchestrator.onTextEdited("a");

        assertEquals(EditOutcome.REJECTED, orchestrator.onVisualEdited(VisualNodeJson.fromJson(AGE_CHECK)));
        assertNull(orchestrator.getVisualDraft());
        assertEquals(List.of(EditSide.A), events.rejected);
        assertEquals(1.0, registry.counter(SyncMetrics.EDIT_REJECTED, "side", "A").count());
    }

    @Test
    void editsDuringSync_areReplayedAfterSuccess() {
        AtomicBoolean once = new AtomicBoolean();
        orchestrator.getSyncController().addStateChangeListener((from, to) -> {
            if (to == SyncState.SYNC_PROCESSING && once.compareAndSet(false, true)) {
                assertEquals(EditOutcome.QUEUED, orchestrator.onTextEdited("x + 2"));
                assertEquals(EditOutcome.QUEUED, orchestrator.onVisualEdited(VisualNodeJson.fromJson(AGE_CHECK)));
            }
        });

        syncText("x + 1");

        assertEquals(1, orchestrator.getSnapshot().version());
        assertEquals("x + 1", orchestrator.getSnapshot().text());
        assertEquals(SyncState.B_DIRTY, orchestrator.getState());
        assertEquals("x + 2", orchestrator.getTextDraft());
        assertEquals(List.of(EditSide.A), events.rejected);

        scheduler.advanceBy(300);
        assertEquals(SyncState.ALL_SYNCED, orchestrator.getState());
        assertEquals("x + 2", orchestrator.getSnapshot().text());
        assertEquals(2, orchestrator.getSnapshot().version());
    }

    @Test
    void snapshotEcho_isNotTreatedAsEdit() {
        List<EditOutcome> echoes = new ArrayList<>();
        orchestrator.addListener(new DataFlowListener() {
            @Override
            public void onSnapshotCommitted(RepresentationSnapshot snapshot) {
                echoes.add(orchestrator.onTextEdited(snapshot.text()));
            }
        });

        orchestrator.onVisualEdited(VisualNodeJson.fromJson(AGE_CHECK));
        scheduler.advanceBy(300);
        scheduler.advanceBy(1000);

        assertEquals(List.of(EditOutcome.REJECTED), echoes);
        assertEquals(SyncState.ALL_SYNCED, orchestrator.getState());
        assertEquals(1, orchestrator.getSnapshot().version());
    }

    @Test
    void listenerFailure_doesNotStopOtherListeners() {
        List<Integer> seen = new ArrayList<>();
        orchestrator.addListener(new DataFlowListener() {
            @Override
            public void onSnapshotCommitted(RepresentationSnapshot snapshot) {
                throw new IllegalStateException("boom");
            }
        });
        orchestrator.addListener(new DataFlowListener() {
            @Override
            public void onSnapshotCommitted(RepresentationSnapshot snapshot) {
                seen.add(snapshot.version());
            }
        });

        syncText("1 + 1");

        assertEquals(List.of(1), seen);
        assertEquals(SyncState.ALL_SYNCED, orchestrator.getState());
    }

    @Test
    void rollbackToVersion_restoresEveryRepresentation() {
        syncText("a + 1");
        syncText("a + 2");
        orchestrator.onTextEdited("a + 3");

        RepresentationSnapshot restored = orchestrator.rollbackToVersion(1).orElseThrow();

        assertEquals("a + 1", restored.text());
        assertEquals(restored, orchestrator.getSnapshot());
        assertEquals("a + 1", orchestrator.getTextDraft());
        assertEquals(SyncState.ALL_SYNCED, orchestrator.getState());

        scheduler.advanceBy(1000);
        assertEquals("a + 1", orchestrator.getSnapshot().text());
        assertEquals(EditOutcome.APPLIED, orchestrator.onVisualEdited(VisualNodeJson.fromJson(AGE_CHECK)));
    }

    @Test
    void rollbackToVersion_unknownVersionMeansLatest() {
        syncText("a + 1");
        syncText("a + 2");

        assertEquals("a + 2", orchestrator.rollbackToVersion(99).orElseThrow().text());
        assertEquals(0, orchestrator.rollbackToVersion(0).orElseThrow().version());
        assertTrue(orchestrator.getSnapshot().isEmpty());
    }

    @Test
    void checkSyncStatus_reportsDirtySideAsConflict() {
        syncText("(a + b) * c");
        assertTrue(orchestrator.checkSyncStatus().inSync());

        orchestrator.onTextEdited("(a + b) * d");
        SyncStatusReport report = orchestrator.checkSyncStatus();

        assertFalse(report.inSync());
        assertEquals(List.of("Side B has unsynced edits"), report.conflicts());
        assertEquals(List.of(report), events.conflicts);
    }

    @Test
    void checkSyncStatus_emptyExpressionIsInSync() {
        SyncStatusReport report = orchestrator.checkSyncStatus();
        assertTrue(report.inSync());
        assertTrue(report.conflicts().isEmpty());
    }

    @Test
    void forceSyncTo_skipsQuietPeriod() {
        orchestrator.onTextEdited("n * 2");

        assertTrue(orchestrator.forceSyncTo(EditSide.A));
        assertEquals(SyncState.ALL_SYNCED, orchestrator.getState());
        assertNotNull(orchestrator.getSnapshot().visual());

        assertFalse(orchestrator.forceSyncTo(EditSide.B));
        scheduler.advanceBy(1000);
        assertEquals(1, orchestrator.getSnapshot().version());
    }

    @Test
    void forceSyncTo_wrongDirectionDoesNothing() {
        orchestrator.onTextEdited("n * 2");

        assertFalse(orchestrator.forceSyncTo(EditSide.B));
        assertEquals(SyncState.B_DIRTY, orchestrator.getState());
    }

    @Test
    void updateFromIntermediate_regeneratesVisualAndText() {
        assertTrue(orchestrator.updateFromIntermediate(new ExpressionParser().parse("x * (y + 1)").getNode()));

        RepresentationSnapshot snapshot = orchestrator.getSnapshot();
        assertEquals("x * (y + 1)", snapshot.text());
        assertEquals(EditSide.A, snapshot.source());
        assertNotNull(snapshot.visual());
        assertEquals(SyncState.ALL_SYNCED, orchestrator.getState());
    }

    @Test
    void updateFromIntermediate_refusedWhileDirty() {
        orchestrator.onTextEdited("a");
        assertFalse(orchestrator.updateFromIntermediate(new ExpressionParser().parse("b").getNode()));
        assertEquals("a", orchestrator.getTextDraft());
    }

    @Test
    void formattedText_dropsRedundantParenthesesButSnapshotKeepsTypedText() {
        assertEquals(Optional.empty(), orchestrator.getFormattedText());

        syncText("((a)) + (b*c)");

        assertEquals("((a)) + (b*c)", orchestrator.getSnapshot().text());
        assertEquals(Optional.of("a + b * c"), orchestrator.getFormattedText());
    }

    @Test
    void blankText_syncsToEmptyExpression() {
        syncText("a");
        syncText("   ");

        RepresentationSnapshot snapshot = orchestrator.getSnapshot();
        assertTrue(snapshot.isEmpty());
        assertNull(snapshot.visual());
        assertEquals(2, snapshot.version());
        assertEquals(Optional.empty(), orchestrator.findNodeAt(0));
    }

    @Test
    void metrics_countSuccessesAndTimeThem() {
        syncText("1 + 2");
        orchestrator.onVisualEdited(VisualNodeJson.fromJson(AGE_CHECK));
        scheduler.advanceBy(300);

        assertEquals(1.0, registry.counter(SyncMetrics.SYNC_SUCCESS, "side", "B").count());
        assertEquals(1.0, registry.counter(SyncMetrics.SYNC_SUCCESS, "side", "A").count());
        assertEquals(1L, registry.find(SyncMetrics.SYNC_DURATION).tag("side", "A").tag("outcome", "success")
                .timer().count());
    }

    @Test
    void metrics_disabledByConfigRegisterNothing() {
        orchestrator.close();
        registry = new SimpleMeterRegistry();
        orchestrator = create(DualEditConfig.builder().metricsEnabled(false).build());

        syncText("1 + 2");
        syncText("1 +");

        assertFalse(orchestrator.getMetrics().isEnabled());
        assertTrue(registry.getMeters().isEmpty());
    }

    @Test
    void close_stopsPendingSyncAndRejectsEdits() {
        orchestrator.onTextEdited("a");
        orchestrator.close();
        scheduler.advanceBy(1000);

        assertEquals(SyncState.B_DIRTY, orchestrator.getState());
        assertEquals(EditOutcome.REJECTED, orchestrator.onTextEdited("b"));
        assertEquals(0, orchestrator.getSnapshot().version());
    }

    @Test
    void emptyVisualWorkspace_syncsToEmptyText() {
        orchestrator.onVisualEdited(VisualNodeJson.fromJson(AGE_CHECK));
        scheduler.advanceBy(300);
        VisualNode none = null;

        orchestrator.onVisualEdited(none);
        scheduler.advanceBy(300);

        assertEquals("", orchestrator.getSnapshot().text());
        assertTrue(orchestrator.getSnapshot().isEmpty());
    }

    private static final class RecordingListener implements DataFlowListener {
        private final List<RepresentationSnapshot> committed = new ArrayList<>();
        private final List<SyncFailedEvent> failures = new ArrayList<>();
        private final List<SyncStatusReport> conflicts = new ArrayList<>();
        private final List<EditSide> rejected = new ArrayList<>();

        @Override
        public void onSnapshotCommitted(RepresentationSnapshot snapshot) {
            committed.add(snapshot);
        }

        @Override
        public void onSyncFailed(SyncFailedEvent event) {
            failures.add(event);
        }

        @Override
        public void onConflict(SyncStatusReport report) {
            conflicts.add(report);
        }

        @Override
        public void onEditRejected(EditSide side) {
            rejected.add(side);
        }
    }
}
