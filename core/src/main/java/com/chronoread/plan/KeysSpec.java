package com.chronoread.plan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Lists the column names of each table, minus an exclusion list.
 */
public final class KeysSpec implements ProcedureSpec {

    /** Columns excluded when no exclusion list is given. */
    public static final List<String> DEFAULT_EXCEPT =
        Collections.unmodifiableList(Arrays.asList(Columns.TIME, Columns.VALUE, Columns.START, Columns.STOP));

    private final List<String> except;

    public KeysSpec(List<String> except) {
        this.except = new ArrayList<>(Objects.requireNonNull(except, "except must not be null"));
    }

    public KeysSpec() {
        this(DEFAULT_EXCEPT);
    }

    public List<String> except() {
        return Collections.unmodifiableList(except);
    }

    @Override
    public ProcedureKind kind() {
        return ProcedureKind.KEYS;
    }

    @Override
    public KeysSpec copy() {
        return new KeysSpec(except);
    }

    @Override
    public String toString() {
        return String.format("Keys(except=%s)", except);
    }
}
