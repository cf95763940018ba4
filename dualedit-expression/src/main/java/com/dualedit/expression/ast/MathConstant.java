package com.dualedit.expression.ast;

import java.util.Optional;

/**
 * Named constants. Their symbols are reserved: a {@link SymbolNode} with one of these names is the
 * constant, not a variable.
 */
public enum MathConstant {
    PI("pi", Math.PI),
    E("e", Math.E),
    PHI("phi", (1 + Math.sqrt(5)) / 2),
    INFINITY("Infinity", Double.POSITIVE_INFINITY);

    private final String symbol;
    private final double value;

    MathConstant(String symbol, double value) {
        this.symbol = symbol;
        this.value = value;
    }

    public String symbol() {
        return symbol;
    }

    public double value() {
        return value;
    }

    public static Optional<MathConstant> fromSymbol(String symbol) {
        for (MathConstant c : values()) {
            if (c.symbol.equals(symbol)) return Optional.of(c);
        }
        return Optional.empty();
    }

    /** Looks up by enum name, case-insensitively (the form used in visual node fields). */
    public static Optional<MathConstant> fromName(String name) {
        if (name == null) return Optional.empty();
        for (MathConstant c : values()) {
            if (c.name().equalsIgnoreCase(name.trim())) return Optional.of(c);
        }
        return Optional.empty();
    }

    public static boolean isReserved(String symbol) {
        return fromSymbol(symbol).isPresent();
    }
}
