package com.dualedit.expression.ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names an expression refers to, in first-occurrence order.
 *
 * @param functions names of called functions
 * @param variables free variable names (reserved constants excluded)
 */
public record ExpressionAnalysis(Set<String> functions, Set<String> variables) {

    public ExpressionAnalysis {
        functions = Collections.unmodifiableSet(new LinkedHashSet<>(functions));
        variables = Collections.unmodifiableSet(new LinkedHashSet<>(variables));
    }
}
