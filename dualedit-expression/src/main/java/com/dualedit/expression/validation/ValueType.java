package com.dualedit.expression.validation;

/** Runtime value types of the evaluator, each with the sample value used for trial evaluation. */
public enum ValueType {
    NUMBER,
    STRING,
    BOOLEAN;

    /**
     * Value bound to a variable of this type during validation. Strings evaluate to the variable's own name.
     */
    public Object sampleFor(String variableName) {
        switch (this) {
            case STRING:
                return variableName;
            case BOOLEAN:
                return Boolean.TRUE;
            default:
                return 1.0;
        }
    }
}
