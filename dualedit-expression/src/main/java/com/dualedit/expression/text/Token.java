package com.dualedit.expression.text;

/**
 * Lexical token with its half-open source span.
 *
 * @param value decoded literal for NUMBER ({@link Double}), STRING and BOOLEAN tokens; null otherwise
 * @param error message for ERROR tokens; null otherwise
 */
public record Token(TokenType type, String text, int start, int end, Object value, String error) {

    static Token of(TokenType type, String text, int start, int end) {
        return new Token(type, text, start, end, null, null);
    }

    public boolean is(TokenType t, String s) {
        return type == t && text.equals(s);
    }

    public boolean is(TokenType t) {
        return type == t;
    }
}
