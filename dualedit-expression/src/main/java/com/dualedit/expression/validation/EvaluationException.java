package com.dualedit.expression.validation;

/** Thrown by {@link ExpressionEvaluator} when an expression cannot be evaluated (type error, unknown name). */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }
}
