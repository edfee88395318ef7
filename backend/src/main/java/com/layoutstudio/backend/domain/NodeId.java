package com.layoutstudio.backend.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque identifier of a node in a layout tree. Assigned once when the node is
 * created and never changed afterwards.
 */
public final class NodeId implements Comparable<NodeId> {

    private final UUID value;

    private NodeId(UUID value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public static NodeId random() {
        return new NodeId(UUID.randomUUID());
    }

    /**
     * @throws IllegalArgumentException if {@code text} is not a UUID
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static NodeId parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("node_id_required");
        return new NodeId(UUID.fromString(text.trim()));
    }

    @Override
    public int compareTo(NodeId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeId)) return false;
        return value.equals(((NodeId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @JsonValue
    @Override
    public String toString() {
        return value.toString();
    }
}
