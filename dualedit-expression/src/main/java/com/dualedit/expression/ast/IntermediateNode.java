package com.dualedit.expression.ast;

import java.util.List;
import java.util.Objects;

/**
 * Node of the canonical expression tree. The variants are fixed: {@link ConstantNode}, {@link SymbolNode},
 * {@link OperatorNode}, {@link FunctionCallNode} and {@link GroupingNode}; code that needs to handle every
 * variant goes through {@link IntermediateNodeVisitor}.
 * <p>
 * Nodes are immutable. {@link #getId()} identifies a node for position mapping and selection;
 * {@code equals}/{@code hashCode} compare structure only and ignore ids.
 */
public abstract class IntermediateNode {

    private final String id;

    IntermediateNode(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id is required");
        }
        this.id = id;
    }

    public final String getId() {
        return id;
    }

    /** Direct children in source order. */
    public abstract List<IntermediateNode> getChildren();

    public abstract <R> R accept(IntermediateNodeVisitor<R> visitor);

    /**
     * Depth-first search by id (this node first, then children in order).
     *
     * @return the node with the given id, or null if not found
     */
    public IntermediateNode findById(String nodeId) {
        if (Objects.equals(id, nodeId)) return this;
        for (IntermediateNode child : getChildren()) {
            IntermediateNode found = child.findById(nodeId);
            if (found != null) return found;
        }
        return null;
    }
}
