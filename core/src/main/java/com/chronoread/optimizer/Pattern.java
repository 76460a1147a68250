package com.chronoread.optimizer;

import com.chronoread.plan.PlanNode;
import com.chronoread.plan.ProcedureKind;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Shape of a plan fragment a rewrite rule applies to, anchored at the node
 * being rewritten and reaching up through its predecessors.
 *
 * <p>Examples:
 * <pre>
 *   Pattern.of(ProcedureKind.FROM)                                    -- a logical read, whatever feeds it
 *   Pattern.of(ProcedureKind.RANGE, Pattern.of(ProcedureKind.PHYSICAL_FROM))  -- range over physical read
 * </pre>
 *
 * <p>A pattern with no predecessor patterns places no constraint on the
 * node's inputs; one with predecessor patterns requires exactly that many
 * predecessors, each matching in order.
 */
public final class Pattern {

    private final ProcedureKind kind;
    private final List<Pattern> predecessors;

    private Pattern(ProcedureKind kind, List<Pattern> predecessors) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.predecessors = predecessors;
    }

    /**
     * Creates a pattern.
     *
     * @param kind the kind the anchor node must have
     * @param predecessors patterns for the anchor's predecessors, in order
     * @return the pattern
     */
    public static Pattern of(ProcedureKind kind, Pattern... predecessors) {
        return new Pattern(kind, Collections.unmodifiableList(Arrays.asList(predecessors)));
    }

    /**
     * Returns the kind of the anchor node.
     *
     * @return the root kind
     */
    public ProcedureKind rootKind() {
        return kind;
    }

    public List<Pattern> predecessors() {
        return predecessors;
    }

    /**
     * Tests whether the fragment ending at {@code node} has this shape.
     *
     * @param node the anchor node
     * @return true on a match
     */
    public boolean matches(PlanNode node) {
        if (node.kind() != kind) {
            return false;
        }
        if (predecessors.isEmpty()) {
            return true;
        }
        List<PlanNode> preds = node.predecessors();
        if (preds.size() != predecessors.size()) {
            return false;
        }
        for (int i = 0; i < preds.size(); i++) {
            if (!predecessors.get(i).matches(preds.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        if (predecessors.isEmpty()) {
            return kind.label();
        }
        return kind.label() + predecessors;
    }
}
