package com.dualedit.expression.ast;

import java.util.UUID;
import java.util.function.Supplier;

/** Source of node ids. Sequential generators are unique within one tree; random ones across trees. */
public interface NodeIdGenerator extends Supplier<String> {

    /** Ids {@code prefix1}, {@code prefix2}, ... */
    static NodeIdGenerator sequential(String prefix) {
        long[] next = {1};
        return () -> prefix + next[0]++;
    }

    static NodeIdGenerator random() {
        return () -> UUID.randomUUID().toString();
    }
}
