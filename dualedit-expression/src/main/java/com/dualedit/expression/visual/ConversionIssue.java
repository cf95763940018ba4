package com.dualedit.expression.visual;

/**
 * A problem converting one node. The node was replaced by a placeholder (or given a fresh id) and the
 * rest of the tree converted normally.
 *
 * @param nodeId id of the offending visual node, may be null
 */
public record ConversionIssue(String nodeId, ConversionIssueCode code, String message) {

    @Override
    public String toString() {
        return code + (nodeId != null ? " [" + nodeId + "]" : "") + ": " + message;
    }
}
