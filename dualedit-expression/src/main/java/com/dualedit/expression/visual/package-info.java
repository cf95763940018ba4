/**
 * Visual block side of the expression pipeline.
 * <ul>
 *   <li>{@link com.dualedit.expression.visual.VisualNode} – immutable block tree, JSON via {@link com.dualedit.expression.visual.VisualNodeJson}</li>
 *   <li>{@link com.dualedit.expression.visual.VisualNodeKind} – block kinds</li>
 *   <li>{@link com.dualedit.expression.visual.VisualTreeConverter} – blocks to expression tree and back</li>
 * </ul>
 */
package com.dualedit.expression.visual;
