package com.chronoread.plan;

import java.util.Objects;

/**
 * Emits the distinct values of one column per table.
 */
public final class DistinctSpec implements ProcedureSpec {

    private final String column;

    public DistinctSpec(String column) {
        this.column = Objects.requireNonNull(column, "column must not be null");
    }

    /**
     * Creates a distinct over the value column.
     *
     * @return the spec
     */
    public static DistinctSpec ofValues() {
        return new DistinctSpec(Columns.VALUE);
    }

    public String column() {
        return column;
    }

    @Override
    public ProcedureKind kind() {
        return ProcedureKind.DISTINCT;
    }

    @Override
    public DistinctSpec copy() {
        return new DistinctSpec(column);
    }

    @Override
    public String toString() {
        return String.format("Distinct(column=%s)", column);
    }
}
