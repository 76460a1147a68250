package com.chronoread.source;

import com.chronoread.plan.NodeId;
import java.util.Objects;

/**
 * Identifies the dataset a source produces, as seen by its consumers.
 */
public final class DatasetId {

    private final String value;

    public DatasetId(String value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public static DatasetId of(String value) {
        return new DatasetId(value);
    }

    /**
     * Returns the dataset id of the source built for a plan node.
     *
     * @param id the plan node id
     * @return the dataset id
     */
    public static DatasetId from(NodeId id) {
        return new DatasetId(id.value());
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DatasetId)) return false;
        return value.equals(((DatasetId) obj).value);
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
