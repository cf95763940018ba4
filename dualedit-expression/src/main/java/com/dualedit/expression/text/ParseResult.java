package com.dualedit.expression.text;

import java.util.Objects;
import java.util.Optional;

/** Outcome of parsing: a tree or a {@link ParseError}, never both. */
public final class ParseResult<T> {

    private final T node;
    private final ParseError error;

    private ParseResult(T node, ParseError error) {
        this.node = node;
        this.error = error;
    }

    public static <T> ParseResult<T> success(T node) {
        return new ParseResult<>(Objects.requireNonNull(node, "node"), null);
    }

    public static <T> ParseResult<T> failure(ParseError error) {
        return new ParseResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> ParseResult<T> failure(String message, int offset) {
        return failure(new ParseError(message, offset));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** @throws IllegalStateException if parsing failed */
    public T getNode() {
        if (error != null) {
            throw new IllegalStateException("Parse failed: " + error);
        }
        return node;
    }

    public Optional<T> node() {
        return Optional.ofNullable(node);
    }

    public ParseError getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult[" + node + "]" : "ParseResult[" + error + "]";
    }
}
