package com.chronoread.source;

import java.util.Objects;

/**
 * Configuration for storage sources.
 *
 * <p>Reads system properties once; unknown values fall back to the defaults.
 */
public final class SourceConfig {

    /** {@code best_effort} or {@code fail_fast}. */
    public static final String PROP_READ_ERROR_POLICY = "chronoread.source.readErrorPolicy";

    public static final ReadErrorPolicy DEFAULT_READ_ERROR_POLICY = ReadErrorPolicy.BEST_EFFORT;

    private final ReadErrorPolicy readErrorPolicy;

    public SourceConfig(ReadErrorPolicy readErrorPolicy) {
        this.readErrorPolicy = Objects.requireNonNull(readErrorPolicy, "readErrorPolicy must not be null");
    }

    /**
     * Creates a configuration from system properties.
     *
     * @return the configuration
     */
    public static SourceConfig fromSystemProperties() {
        return new SourceConfig(getConfiguredReadErrorPolicy());
    }

    public ReadErrorPolicy readErrorPolicy() {
        return readErrorPolicy;
    }

    private static ReadErrorPolicy getConfiguredReadErrorPolicy() {
        String value = System.getProperty(PROP_READ_ERROR_POLICY);
        if (value != null) {
            try {
                return ReadErrorPolicy.parse(value);
            } catch (IllegalArgumentException e) {
                // Ignore, use default
            }
        }
        return DEFAULT_READ_ERROR_POLICY;
    }

    @Override
    public String toString() {
        return "SourceConfig(readErrorPolicy=" + readErrorPolicy + ")";
    }
}
