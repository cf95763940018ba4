package com.dualedit.expression.text;

/**
 * Why text could not be parsed.
 *
 * @param offset character offset of the offending token (text length for unexpected end)
 */
public record ParseError(String message, int offset) {

    @Override
    public String toString() {
        return message + " at offset " + offset;
    }
}
