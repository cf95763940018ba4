package com.dualedit.mapping;

/**
 * Half-open range {@code [start, end)} into one specific text.
 */
public record Position(int start, int end) {

    public Position {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid position [" + start + ", " + end + ")");
        }
    }

    public static Position empty(int offset) {
        return new Position(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public boolean contains(Position other) {
        return other.start >= start && other.end <= end;
    }

    /** Whether the ranges share at least one offset; empty ranges overlap nothing. */
    public boolean overlaps(Position other) {
        return !isEmpty() && !other.isEmpty() && start < other.end && other.start < end;
    }

    Position union(Position other) {
        return new Position(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
