/**
 * Canonical expression tree shared by the visual and text representations.
 * <ul>
 *   <li>{@link com.dualedit.expression.ast.IntermediateNode} and its five variants</li>
 *   <li>{@link com.dualedit.expression.ast.Operator} and {@link com.dualedit.expression.ast.Order} – operators and precedence classes</li>
 *   <li>{@link com.dualedit.expression.ast.IntermediateNodes} – walking, grouping removal, name analysis</li>
 * </ul>
 */
package com.dualedit.expression.ast;
