package com.dualedit.expression.visual;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One block of the visual editor. {@code kind} selects the conversion rule, {@code fields} hold primitive
 * values (numbers are held as {@link Double}), {@code slots} attach single children by name and
 * {@code next} chains a sibling. Nodes are immutable, so a tree built from them cannot contain cycles.
 * Equality is structural and includes ids.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class VisualNode {

    private final String kind;
    private final String id;
    private final Map<String, Object> fields;
    private final Map<String, VisualNode> slots;
    private final VisualNode next;

    @JsonCreator
    public VisualNode(
            @JsonProperty("kind") String kind,
            @JsonProperty("id") String id,
            @JsonProperty("fields") Map<String, Object> fields,
            @JsonProperty("slots") Map<String, VisualNode> slots,
            @JsonProperty("next") VisualNode next) {
        this.kind = kind != null ? kind : VisualNodeKind.UNKNOWN.toValue();
        this.id = id;
        this.fields = normalizeFields(fields);
        this.slots = slots != null ? Collections.unmodifiableMap(new LinkedHashMap<>(slots)) : Map.of();
        this.next = next;
    }

    private static Map<String, Object> normalizeFields(Map<String, Object> fields) {
        if (fields == null || fields.isEmpty()) return Map.of();
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            Object v = e.getValue();
            if (v instanceof Number) {
                v = ((Number) v).doubleValue();
            } else if (v != null && !(v instanceof String) && !(v instanceof Boolean)) {
                throw new IllegalArgumentException("Field " + e.getKey() + " must be a primitive, got " + v.getClass().getSimpleName());
            }
            copy.put(e.getKey(), v);
        }
        return Collections.unmodifiableMap(copy);
    }

    public static Builder builder(VisualNodeKind kind) {
        return new Builder(kind.toValue());
    }

    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    public String getKind() {
        return kind;
    }

    @JsonIgnore
    public VisualNodeKind getKindType() {
        return VisualNodeKind.fromValue(kind);
    }

    public String getId() {
        return id;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public Map<String, VisualNode> getSlots() {
        return slots;
    }

    public VisualNode getNext() {
        return next;
    }

    public Object field(String name) {
        return fields.get(name);
    }

    public VisualNode slot(String name) {
        return slots.get(name);
    }

    public VisualNode withNext(VisualNode newNext) {
        return new VisualNode(kind, id, fields, slots, newNext);
    }

    public Builder toBuilder() {
        Builder b = new Builder(kind).id(id).next(next);
        b.fields.putAll(fields);
        b.slots.putAll(slots);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VisualNode)) return false;
        VisualNode that = (VisualNode) o;
        return kind.equals(that.kind) && Objects.equals(id, that.id) && fields.equals(that.fields)
                && slots.equals(that.slots) && Objects.equals(next, that.next);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id, fields, slots, next);
    }

    @Override
    public String toString() {
        return "VisualNode{" + kind + (id != null ? "#" + id : "")
                + (fields.isEmpty() ? "" : ", fields=" + fields)
                + (slots.isEmpty() ? "" : ", slots=" + slots)
                + (next == null ? "" : ", next=" + next) + "}";
    }

    public static final class Builder {
        private final String kind;
        private String id;
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private final Map<String, VisualNode> slots = new LinkedHashMap<>();
        private VisualNode next;

        private Builder(String kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder field(String name, Object value) {
            fields.put(name, value);
            return this;
        }

        public Builder slot(String name, VisualNode child) {
            if (child != null) {
                slots.put(name, child);
            }
            return this;
        }

        public Builder next(VisualNode next) {
            this.next = next;
            return this;
        }

        public VisualNode build() {
            return new VisualNode(kind, id, fields, slots, next);
        }
    }
}
