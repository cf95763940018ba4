package com.dualedit.expression.ast;

/** Type of a literal value. */
public enum ConstantType {
    /** Held as {@link Double}. */
    NUMBER,
    STRING,
    BOOLEAN
}
