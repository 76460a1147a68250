package com.chronoread.plan;

/**
 * Reserved column names of storage tables.
 */
public final class Columns {

    private Columns() {}

    /** The measured value column. */
    public static final String VALUE = "_value";

    /** The point timestamp column. */
    public static final String TIME = "_time";

    /** Window start column, always part of the group key. */
    public static final String START = "_start";

    /** Window stop column, always part of the group key. */
    public static final String STOP = "_stop";
}
