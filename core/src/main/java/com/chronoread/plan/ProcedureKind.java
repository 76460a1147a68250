package com.chronoread.plan;

/**
 * Tag identifying the kind of operation a plan node performs.
 *
 * <p>Rewrite rules match on sequences of these tags rather than on spec
 * classes, so adding a new spec never changes how existing rules match.
 */
public enum ProcedureKind {
    FROM("from"),
    PHYSICAL_FROM("physFrom"),
    RANGE("range"),
    FILTER("filter"),
    DISTINCT("distinct"),
    GROUP("group"),
    KEYS("keys");

    private final String label;

    ProcedureKind(String label) {
        this.label = label;
    }

    /**
     * Returns the short label used in node ids and explain output.
     *
     * @return the label
     */
    public String label() {
        return label;
    }
}
