package com.chronoread.optimizer;

/**
 * Configuration for {@link PhysicalPlanner}.
 *
 * <p>Reads system properties once; malformed or non-positive values fall back
 * to the defaults.
 */
public final class PlannerConfig {

    /** Maximum number of full rewrite passes over a plan. */
    public static final String PROP_MAX_ITERATIONS = "chronoread.planner.maxIterations";

    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private final int maxIterations;

    /**
     * Creates a configuration with an explicit pass cap.
     *
     * @param maxIterations the maximum number of passes, must be positive
     */
    public PlannerConfig(int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    /**
     * Creates a configuration from system properties.
     *
     * @return the configuration
     */
    public static PlannerConfig fromSystemProperties() {
        return new PlannerConfig(getConfiguredMaxIterations());
    }

    public int maxIterations() {
        return maxIterations;
    }

    private static int getConfiguredMaxIterations() {
        String value = System.getProperty(PROP_MAX_ITERATIONS);
        if (value != null) {
            try {
                int iterations = Integer.parseInt(value.trim());
                if (iterations > 0) {
                    return iterations;
                }
            } catch (NumberFormatException e) {
                // Ignore, use default
            }
        }
        return DEFAULT_MAX_ITERATIONS;
    }

    @Override
    public String toString() {
        return "PlannerConfig(maxIterations=" + maxIterations + ")";
    }
}
