package com.dualedit.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Node id to text range table for one text, plus its inverse. Built by {@link PositionMapper}; immutable.
 * Entries are in pre-order, so a parent precedes its children.
 */
public final class Mapping {

    private static final Mapping EMPTY = new Mapping("", Map.of(), Map.of(), Map.of());

    private final String text;
    private final Map<String, Position> positions;
    private final Map<String, String> parents;
    private final Map<String, Integer> depths;
    private final Map<Position, String> byPosition;

    Mapping(String text, Map<String, Position> positions, Map<String, String> parents, Map<String, Integer> depths) {
        this.text = text;
        this.positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        this.parents = Collections.unmodifiableMap(new LinkedHashMap<>(parents));
        this.depths = Collections.unmodifiableMap(new LinkedHashMap<>(depths));
        Map<Position, String> inverse = new LinkedHashMap<>();
        // pre-order: a deeper node with the same range overwrites its ancestor
        positions.forEach((id, position) -> inverse.put(position, id));
        this.byPosition = Collections.unmodifiableMap(inverse);
    }

    public static Mapping empty() {
        return EMPTY;
    }

    /** The text the ranges refer to. */
    public String getText() {
        return text;
    }

    public Optional<Position> positionOf(String nodeId) {
        return Optional.ofNullable(positions.get(nodeId));
    }

    /** Innermost node whose range is exactly {@code position}. */
    public Optional<String> nodeAt(Position position) {
        return Optional.ofNullable(byPosition.get(position));
    }

    public Optional<String> parentOf(String nodeId) {
        return Optional.ofNullable(parents.get(nodeId));
    }

    /** Distance from the root (0), or -1 when the id is not mapped. */
    public int depthOf(String nodeId) {
        return depths.getOrDefault(nodeId, -1);
    }

    public Map<String, Position> getPositions() {
        return positions;
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }

    public int size() {
        return positions.size();
    }

    @Override
    public String toString() {
        return "Mapping{" + positions + "}";
    }
}
