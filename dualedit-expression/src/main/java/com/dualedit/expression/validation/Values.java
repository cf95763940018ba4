package com.dualedit.expression.validation;

import com.dualedit.expression.text.ExpressionPrinter;

/** Coercions between evaluator values ({@link Double}, {@link String}, {@link Boolean}). */
final class Values {

    private Values() {
    }

    static double toNumber(Object value, String where) {
        if (value instanceof Double) {
            return (Double) value;
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? 1 : 0;
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new EvaluationException("Cannot convert \"" + value + "\" to a number in " + where);
            }
        }
        throw new EvaluationException("Unsupported value " + value + " in " + where);
    }

    static boolean toBoolean(Object value, String where) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Double) {
            return (Double) value != 0;
        }
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        throw new EvaluationException("Unsupported value " + value + " in " + where);
    }

    static String requireText(Object value, String where) {
        if (value instanceof String) {
            return (String) value;
        }
        throw new EvaluationException(where + " expects text, got " + describe(value));
    }

    static String toText(Object value) {
        if (value instanceof Double) {
            return ExpressionPrinter.formatNumber((Double) value);
        }
        return String.valueOf(value);
    }

    static long toInteger(Object value, String where) {
        double d = toNumber(value, where);
        if (d != Math.rint(d) || Double.isInfinite(d)) {
            throw new EvaluationException(where + " expects integers, got " + toText(value));
        }
        return (long) d;
    }

    static String describe(Object value) {
        if (value instanceof String) return "text \"" + value + "\"";
        if (value instanceof Boolean) return "boolean " + value;
        return "number " + toText(value);
    }
}
