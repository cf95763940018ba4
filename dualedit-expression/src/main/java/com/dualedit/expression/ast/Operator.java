package com.dualedit.expression.ast;

import java.util.Optional;

/**
 * Operators of the expression language. The same symbol can name a unary and a binary operator
 * ({@code -}); {@link #binary(String)} resolves the binary one.
 */
public enum Operator {
    ADD("+", Order.ADDITIVE, 2),
    SUBTRACT("-", Order.ADDITIVE, 2),
    MULTIPLY("*", Order.MULTIPLICATIVE, 2),
    DIVIDE("/", Order.MULTIPLICATIVE, 2),
    MODULO("%", Order.MULTIPLICATIVE, 2),
    /** Right-associative; binds tighter than unary minus ({@code -a ^ b} is {@code -(a ^ b)}). */
    POWER("^", Order.POWER, 2),
    NEGATE("-", Order.UNARY, 1),
    NOT("not", Order.UNARY, 1),
    EQUAL("==", Order.RELATIONAL, 2),
    NOT_EQUAL("!=", Order.RELATIONAL, 2),
    LESS("<", Order.RELATIONAL, 2),
    LESS_EQUAL("<=", Order.RELATIONAL, 2),
    GREATER(">", Order.RELATIONAL, 2),
    GREATER_EQUAL(">=", Order.RELATIONAL, 2),
    AND("and", Order.LOGICAL_AND, 2),
    OR("or", Order.LOGICAL_OR, 2),
    /** {@code condition ? then : else}; operands in that order. */
    CONDITIONAL("?:", Order.CONDITIONAL, 3);

    private final String symbol;
    private final Order order;
    private final int arity;

    Operator(String symbol, Order order, int arity) {
        this.symbol = symbol;
        this.order = order;
        this.arity = arity;
    }

    public String symbol() {
        return symbol;
    }

    public Order order() {
        return order;
    }

    public int arity() {
        return arity;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    public boolean isBinary() {
        return arity == 2;
    }

    /**
     * Widest order the grammar accepts at operand {@code index} without parentheses. Text generation
     * wraps exactly the operands whose order exceeds this, so regenerated text reparses to the same tree.
     */
    public Order operandContext(int index) {
        if (index < 0 || index >= arity) {
            throw new IndexOutOfBoundsException("Operand " + index + " of " + this);
        }
        switch (this) {
            case POWER:
                return index == 0 ? Order.FUNCTION_CALL : Order.UNARY;
            case CONDITIONAL:
                return index == 0 ? Order.LOGICAL_OR : Order.CONDITIONAL;
            default:
                if (isUnary() || index == 0) {
                    return order;
                }
                return Order.values()[order.ordinal() - 1];
        }
    }

    public static Optional<Operator> binary(String symbol) {
        for (Operator op : values()) {
            if (op.isBinary() && op.symbol.equals(symbol)) return Optional.of(op);
        }
        return Optional.empty();
    }
}
