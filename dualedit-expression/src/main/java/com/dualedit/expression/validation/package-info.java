/**
 * Validation of expression trees: function catalog checks plus a trial evaluation whose variable bindings come
 * from a replaceable {@link com.dualedit.expression.validation.VariableTypeHint}.
 */
package com.dualedit.expression.validation;
