package com.dualedit.expression.ast;

import java.util.List;

/** Variable reference or reserved constant name (see {@link MathConstant}). */
public final class SymbolNode extends IntermediateNode {

    private final String name;

    public SymbolNode(String id, String name) {
        super(id);
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Symbol name is required");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public boolean isReservedConstant() {
        return MathConstant.isReserved(name);
    }

    @Override
    public List<IntermediateNode> getChildren() {
        return List.of();
    }

    @Override
    public <R> R accept(IntermediateNodeVisitor<R> visitor) {
        return visitor.visitSymbol(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolNode)) return false;
        return name.equals(((SymbolNode) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Symbol(" + name + ")";
    }
}
