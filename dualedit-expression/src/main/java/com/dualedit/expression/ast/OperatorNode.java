package com.dualedit.expression.ast;

import java.util.List;
import java.util.Objects;

/** Operator application; the operand count always equals {@link Operator#arity()}. */
public final class OperatorNode extends IntermediateNode {

    private final Operator operator;
    private final List<IntermediateNode> operands;

    public OperatorNode(String id, Operator operator, List<IntermediateNode> operands) {
        super(id);
        this.operator = Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operands, "operands");
        if (operands.size() != operator.arity()) {
            throw new IllegalArgumentException(operator + " takes " + operator.arity() + " operands, got " + operands.size());
        }
        this.operands = List.copyOf(operands);
    }

    public OperatorNode(String id, Operator operator, IntermediateNode... operands) {
        this(id, operator, List.of(operands));
    }

    public Operator getOperator() {
        return operator;
    }

    public List<IntermediateNode> getOperands() {
        return operands;
    }

    public IntermediateNode getOperand(int index) {
        return operands.get(index);
    }

    @Override
    public List<IntermediateNode> getChildren() {
        return operands;
    }

    @Override
    public <R> R accept(IntermediateNodeVisitor<R> visitor) {
        return visitor.visitOperator(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OperatorNode)) return false;
        OperatorNode that = (OperatorNode) o;
        return operator == that.operator && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operands);
    }

    @Override
    public String toString() {
        return "Operator(" + operator.symbol() + ", " + operands + ")";
    }
}
