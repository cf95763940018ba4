package com.dualedit.expression.visual;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Block kinds the visual editor exchanges. JSON uses the lower-case value ({@code math_number});
 * unknown values resolve to {@link #UNKNOWN}.
 */
public enum VisualNodeKind {
    MATH_NUMBER("math_number"),
    MATH_VARIABLE("math_variable"),
    /** Named constant: field {@code CONSTANT} is PI, E, PHI or INFINITY. */
    MATH_CONSTANT("math_constant"),
    /** Field {@code OP}: ADD, MINUS, MULTIPLY, DIVIDE, POWER, MODULO; slots {@code A}, {@code B}. */
    MATH_ARITHMETIC("math_arithmetic"),
    MATH_NEGATE("math_negate"),
    MATH_FUNCTION("math_function"),
    MATH_FUNCTION_DUAL("math_function_dual"),
    /** Three or more arguments: first in slot {@code ARGS}, the rest chained through {@code next}. */
    FUNCTION_CALL("function_call"),
    MATH_PARENTHESES("math_parentheses"),
    LOGIC_PARENTHESES("logic_parentheses"),
    /** Field {@code OP}: EQ, NEQ, LT, LTE, GT, GTE. */
    LOGIC_COMPARE("logic_compare"),
    /** Field {@code OP}: AND, OR. */
    LOGIC_OPERATION("logic_operation"),
    LOGIC_NEGATE("logic_negate"),
    LOGIC_BOOLEAN("logic_boolean"),
    LOGIC_TERNARY("logic_ternary"),
    TEXT_STRING("text_string"),
    /** Joins two strings; maps to {@code concat(a, b)}. */
    TEXT_JOIN("text_join"),
    /** Used when a node carries a kind this version does not know. */
    UNKNOWN("unknown");

    private final String value;

    VisualNodeKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static VisualNodeKind fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (VisualNodeKind k : values()) {
            if (k != UNKNOWN && k.value.equals(normalized)) return k;
        }
        return UNKNOWN;
    }

    /** Kinds whose value slots hold boolean expressions. */
    public boolean isLogical() {
        return this == LOGIC_OPERATION || this == LOGIC_NEGATE || this == LOGIC_TERNARY || this == LOGIC_PARENTHESES;
    }
}
