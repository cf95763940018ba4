package com.dualedit.expression.validation;

import java.util.Objects;

/** Gives every variable the same type. */
public final class FixedTypeHint implements VariableTypeHint {

    public static final FixedTypeHint ALL_NUMBERS = new FixedTypeHint(ValueType.NUMBER);
    public static final FixedTypeHint ALL_STRINGS = new FixedTypeHint(ValueType.STRING);

    private final ValueType type;

    public FixedTypeHint(ValueType type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public ValueType typeOf(String variableName) {
        return type;
    }

    @Override
    public String toString() {
        return "FixedTypeHint[" + type + "]";
    }
}
