/**
 * Structural transformer between the visual block tree, the expression tree and text.
 * <ul>
 *   <li>{@link com.dualedit.expression.RepresentationTransformer} – the conversion contract</li>
 *   <li>{@link com.dualedit.expression.ExpressionTransformer} – the expression implementation</li>
 *   <li>{@code ast} – tree model; {@code text} – lexer, parser, printer; {@code visual} – blocks;
 *       {@code validation} – function catalog and trial evaluation</li>
 * </ul>
 */
package com.dualedit.expression;
