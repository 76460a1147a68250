package com.chronoread.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Regroups rows into tables by a set of key columns.
 */
public final class GroupSpec implements ProcedureSpec {

    private final GroupMode mode;
    private final List<String> keys;

    /**
     * Creates a group spec.
     *
     * @param mode the group mode
     * @param keys the key columns, meaningful for {@link GroupMode#BY} and {@link GroupMode#EXCEPT}
     */
    public GroupSpec(GroupMode mode, List<String> keys) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.keys = new ArrayList<>(Objects.requireNonNull(keys, "keys must not be null"));
    }

    public static GroupSpec by(List<String> keys) {
        return new GroupSpec(GroupMode.BY, keys);
    }

    public static GroupSpec except(List<String> keys) {
        return new GroupSpec(GroupMode.EXCEPT, keys);
    }

    public GroupMode mode() {
        return mode;
    }

    /**
     * Returns the key columns.
     *
     * @return an unmodifiable list of keys
     */
    public List<String> keys() {
        return Collections.unmodifiableList(keys);
    }

    @Override
    public ProcedureKind kind() {
        return ProcedureKind.GROUP;
    }

    @Override
    public GroupSpec copy() {
        return new GroupSpec(mode, keys);
    }

    @Override
    public String toString() {
        return String.format("Group(mode=%s, keys=%s)", mode, keys);
    }
}
