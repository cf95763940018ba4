package com.dualedit.expression.visual;

/** Structural problems found while converting between the visual tree and the expression tree. */
public enum ConversionIssueCode {
    UNKNOWN_NODE_KIND,
    UNKNOWN_OPERATOR,
    MISSING_SLOT,
    INVALID_FIELD,
    /** A {@code next} chain where the kind does not use one; the chain was not converted. */
    IGNORED_NEXT,
    DUPLICATE_ID
}
