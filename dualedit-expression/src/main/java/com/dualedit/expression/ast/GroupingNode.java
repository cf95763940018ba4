package com.dualedit.expression.ast;

import java.util.List;
import java.util.Objects;

/**
 * Parentheses the user typed. Only text keeps them; the visual tree encodes precedence by nesting
 * and drops the wrapper.
 */
public final class GroupingNode extends IntermediateNode {

    private final IntermediateNode content;

    public GroupingNode(String id, IntermediateNode content) {
        super(id);
        this.content = Objects.requireNonNull(content, "content");
    }

    public IntermediateNode getContent() {
        return content;
    }

    @Override
    public List<IntermediateNode> getChildren() {
        return List.of(content);
    }

    @Override
    public <R> R accept(IntermediateNodeVisitor<R> visitor) {
        return visitor.visitGrouping(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupingNode)) return false;
        return content.equals(((GroupingNode) o).content);
    }

    @Override
    public int hashCode() {
        return 31 * content.hashCode() + 7;
    }

    @Override
    public String toString() {
        return "Grouping(" + content + ")";
    }
}
