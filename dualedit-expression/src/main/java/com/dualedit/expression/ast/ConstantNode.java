package com.dualedit.expression.ast;

import java.util.List;
import java.util.Objects;

/** Literal number, string or boolean. */
public final class ConstantNode extends IntermediateNode {

    private final ConstantType type;
    private final Object value;

    private ConstantNode(String id, ConstantType type, Object value) {
        super(id);
        this.type = type;
        this.value = value;
    }

    public static ConstantNode number(String id, double value) {
        return new ConstantNode(id, ConstantType.NUMBER, value);
    }

    public static ConstantNode string(String id, String value) {
        return new ConstantNode(id, ConstantType.STRING, Objects.requireNonNull(value, "value"));
    }

    public static ConstantNode bool(String id, boolean value) {
        return new ConstantNode(id, ConstantType.BOOLEAN, value);
    }

    public ConstantType getType() {
        return type;
    }

    /** {@link Double}, {@link String} or {@link Boolean} depending on {@link #getType()}. */
    public Object getValue() {
        return value;
    }

    public double getNumber() {
        if (type != ConstantType.NUMBER) {
            throw new IllegalStateException("Not a number constant: " + this);
        }
        return (Double) value;
    }

    @Override
    public List<IntermediateNode> getChildren() {
        return List.of();
    }

    @Override
    public <R> R accept(IntermediateNodeVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstantNode)) return false;
        ConstantNode that = (ConstantNode) o;
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return "Constant(" + (type == ConstantType.STRING ? "\"" + value + "\"" : value) + ")";
    }
}
