package com.dualedit.expression.text;

public enum TokenType {
    NUMBER,
    STRING,
    /** {@code true} or {@code false}. */
    BOOLEAN,
    IDENTIFIER,
    /** {@code and}, {@code or}, {@code not}. */
    KEYWORD,
    OPERATOR,
    LPAREN,
    RPAREN,
    COMMA,
    QUESTION,
    COLON,
    /** Text that is not a valid token; {@link Token#error()} says why. */
    ERROR,
    EOF
}
