package com.chronoread.source;

import java.time.Duration;
import java.util.Objects;

/**
 * Catalog entry for a retention policy.
 */
public final class RetentionPolicyInfo {

    private final String name;
    private final Duration duration;

    /**
     * Creates a retention policy entry.
     *
     * @param name the policy name
     * @param duration how long data is kept, {@link Duration#ZERO} for forever
     */
    public RetentionPolicyInfo(String name, Duration duration) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.duration = Objects.requireNonNull(duration, "duration must not be null");
    }

    public String name() {
        return name;
    }

    public Duration duration() {
        return duration;
    }

    @Override
    public String toString() {
        return String.format("RetentionPolicyInfo(name=%s, duration=%s)", name, duration);
    }
}
