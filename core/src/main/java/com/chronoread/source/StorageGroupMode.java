package com.chronoread.source;

import com.chronoread.plan.GroupMode;

/**
 * Grouping mode understood by the storage layer.
 */
public enum StorageGroupMode {
    /** Storage's default, which is {@link #ALL}. */
    DEFAULT,
    /** Merge all series into a single group. */
    NONE,
    /** One group per series. */
    ALL,
    /** One group per distinct combination of the group keys. */
    BY,
    /** One group per distinct combination of all keys except the group keys. */
    EXCEPT;

    /**
     * Maps a plan grouping mode to the storage mode.
     *
     * @param mode the plan mode
     * @return the storage mode
     */
    public static StorageGroupMode from(GroupMode mode) {
        switch (mode) {
            case NONE:
                return DEFAULT;
            case ALL:
                return ALL;
            case BY:
                return BY;
            case EXCEPT:
                return EXCEPT;
            default:
                throw new IllegalArgumentException("Unknown group mode: " + mode);
        }
    }
}
