package com.chronoread.plan;

import java.util.Objects;

/**
 * Stable identifier of a node within a plan graph.
 */
public final class NodeId {

    private final String value;

    public NodeId(String value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("node id must not be empty");
        }
    }

    public static NodeId of(String value) {
        return new NodeId(value);
    }

    /**
     * Returns the id given to a node that replaces two merged nodes.
     *
     * @param bottom the predecessor being merged away
     * @param top the node it is merged into
     * @return {@code merged_<bottom>_<top>}
     */
    public static NodeId merged(NodeId bottom, NodeId top) {
        return new NodeId("merged_" + bottom.value + "_" + top.value);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NodeId)) return false;
        return value.equals(((NodeId) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
