package com.dualedit.dataflow;

import com.dualedit.expression.ast.IntermediateNode;
import com.dualedit.expression.visual.VisualNode;
import com.dualedit.mapping.Mapping;
import com.dualedit.sync.EditSide;

import java.util.Objects;

/**
 * The three representations as they were when a sync committed, with the text mapping for that exact text.
 * An empty expression has null {@code visual} and {@code intermediate}.
 *
 * @param version controller version the snapshot was committed under
 * @param source  side the sync started from; null for the initial snapshot
 */
public record RepresentationSnapshot(
        VisualNode visual,
        IntermediateNode intermediate,
        String text,
        Mapping mapping,
        int version,
        long timestampMillis,
        EditSide source) {

    public RepresentationSnapshot {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(mapping, "mapping");
    }

    static RepresentationSnapshot initial(long timestampMillis) {
        return new RepresentationSnapshot(null, null, "", Mapping.empty(), 0, timestampMillis, null);
    }

    public boolean isEmpty() {
        return intermediate == null;
    }

    RepresentationSnapshot withVersion(int newVersion) {
        return new RepresentationSnapshot(visual, intermediate, text, mapping, newVersion, timestampMillis, source);
    }
}
