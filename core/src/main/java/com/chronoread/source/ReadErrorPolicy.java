package com.chronoread.source;

import java.util.Locale;

/**
 * What a running source does when a storage read fails.
 */
public enum ReadErrorPolicy {
    /**
     * Log the failure and end the stream as if the data ran out. Consumers
     * see a successful finish and no error.
     */
    BEST_EFFORT,
    /**
     * Log the failure and report it to consumers through
     * {@link Transformation#finish}.
     */
    FAIL_FAST;

    /**
     * Parses a policy name such as {@code best_effort} or {@code fail-fast}.
     *
     * @param value the name, case-insensitive
     * @return the policy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ReadErrorPolicy parse(String value) {
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
