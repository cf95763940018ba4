/**
 * Links expression tree nodes to ranges of the text they were printed from or parsed from.
 * <ul>
 *   <li>{@link com.dualedit.mapping.PositionMapper} builds a {@link com.dualedit.mapping.Mapping} with one
 *   forward scan and answers "which node is at this offset" and "where is this node".</li>
 *   <li>{@link com.dualedit.mapping.Position} is a half-open {@code [start, end)} range.</li>
 * </ul>
 * A mapping belongs to one exact text and is rebuilt, never patched, when the text or tree changes.
 */
package com.dualedit.mapping;
