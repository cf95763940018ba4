/**
 * Text side of the expression pipeline: {@link com.dualedit.expression.text.ExpressionLexer},
 * {@link com.dualedit.expression.text.ExpressionParser} (text to tree, failing with a
 * {@link com.dualedit.expression.text.ParseError}) and {@link com.dualedit.expression.text.ExpressionPrinter}
 * (tree to text with minimal parentheses).
 */
package com.dualedit.expression.text;
