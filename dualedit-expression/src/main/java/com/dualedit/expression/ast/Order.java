package com.dualedit.expression.ast;

/**
 * Precedence class used when generating text. Lower levels bind tighter; a child is parenthesized
 * only when its level is greater than the level its position accepts.
 */
public enum Order {
    ATOMIC(0),
    FUNCTION_CALL(1),
    POWER(2),
    UNARY(3),
    MULTIPLICATIVE(4),
    ADDITIVE(5),
    RELATIONAL(6),
    LOGICAL_AND(7),
    LOGICAL_OR(8),
    CONDITIONAL(9),
    /** Context that accepts anything (top level, function arguments). */
    NONE(99);

    private final int level;

    Order(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    /** Whether an expression of this order must be wrapped in parentheses where {@code context} is accepted. */
    public boolean needsParenthesesIn(Order context) {
        return level > context.level;
    }
}
