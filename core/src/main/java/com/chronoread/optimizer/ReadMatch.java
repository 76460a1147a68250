package com.chronoread.optimizer;

import com.chronoread.plan.PhysicalFromSpec;
import com.chronoread.plan.PlanNode;
import com.chronoread.plan.ProcedureSpec;

/**
 * Typed handle on a matched {@code operation -> physical read} fragment.
 *
 * @param <S> the spec type of the operation sitting over the read
 */
public final class ReadMatch<S extends ProcedureSpec> {

    private final PlanNode node;
    private final S spec;
    private final PlanNode read;
    private final PhysicalFromSpec readSpec;

    ReadMatch(PlanNode node, S spec, PlanNode read, PhysicalFromSpec readSpec) {
        this.node = node;
        this.spec = spec;
        this.read = read;
        this.readSpec = readSpec;
    }

    /** The operation node over the read. */
    public PlanNode node() {
        return node;
    }

    /** The operation node's spec. */
    public S spec() {
        return spec;
    }

    /** The physical read node. */
    public PlanNode read() {
        return read;
    }

    /** The physical read's current spec; copy before changing. */
    public PhysicalFromSpec readSpec() {
        return readSpec;
    }
}
