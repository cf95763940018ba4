package com.dualedit.expression.validation;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A callable function: name, accepted argument counts and implementation.
 *
 * @param maxArity {@link Integer#MAX_VALUE} for variadic functions
 */
public record FunctionDefinition(String name, int minArity, int maxArity, Function<List<Object>, Object> body) {

    public FunctionDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        if (minArity < 1 || maxArity < minArity) {
            throw new IllegalArgumentException("Invalid arity " + minArity + ".." + maxArity + " for " + name);
        }
    }

    public static FunctionDefinition fixed(String name, int arity, Function<List<Object>, Object> body) {
        return new FunctionDefinition(name, arity, arity, body);
    }

    public static FunctionDefinition variadic(String name, int minArity, Function<List<Object>, Object> body) {
        return new FunctionDefinition(name, minArity, Integer.MAX_VALUE, body);
    }

    public boolean accepts(int argumentCount) {
        return argumentCount >= minArity && argumentCount <= maxArity;
    }

    public String describeArity() {
        if (minArity == maxArity) return String.valueOf(minArity);
        if (maxArity == Integer.MAX_VALUE) return "at least " + minArity;
        return minArity + " to " + maxArity;
    }
}
