package com.chronoread.plan;

/**
 * How a group operation partitions series into tables.
 */
public enum GroupMode {
    /** All series merged into a single group. */
    NONE,
    /** One table per series. */
    ALL,
    /** One table per distinct value combination of the listed keys. */
    BY,
    /** One table per distinct value combination of all keys except the listed ones. */
    EXCEPT
}
