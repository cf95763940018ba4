package com.dualedit.expression.validation;

/**
 * Guesses the type of a free variable so validation can evaluate an expression without real bindings.
 * This is a policy, not type inference: implementations may be wrong, and validation falls back to other
 * bindings when the guess does not evaluate.
 */
@FunctionalInterface
public interface VariableTypeHint {

    ValueType typeOf(String variableName);
}
