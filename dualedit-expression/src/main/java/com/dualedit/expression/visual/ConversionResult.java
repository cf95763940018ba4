package com.dualedit.expression.visual;

import java.util.List;

/**
 * Converted tree plus the issues met on the way. A result with issues still carries a complete tree.
 *
 * @param node converted root; null only when the input was null
 */
public record ConversionResult<T>(T node, List<ConversionIssue> issues) {

    public ConversionResult {
        issues = List.copyOf(issues);
    }

    public static <T> ConversionResult<T> clean(T node) {
        return new ConversionResult<>(node, List.of());
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
