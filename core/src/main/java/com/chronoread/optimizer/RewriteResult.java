package com.chronoread.optimizer;

import com.chronoread.plan.PlanNode;
import java.util.Objects;

/**
 * Outcome of applying a rewrite rule to a node.
 *
 * <p>{@code changed == false} is the normal "rule does not apply" answer; it
 * tells the driver the graph is untouched and the rule must not be retried
 * on the same node in the same pass.
 */
public final class RewriteResult {

    private final PlanNode node;
    private final boolean changed;

    private RewriteResult(PlanNode node, boolean changed) {
        this.node = Objects.requireNonNull(node, "node must not be null");
        this.changed = changed;
    }

    /**
     * Reports a rewrite that changed the graph.
     *
     * @param node the node now standing where the rewritten node was
     * @return the result
     */
    public static RewriteResult changed(PlanNode node) {
        return new RewriteResult(node, true);
    }

    /**
     * Reports that the rule did not apply.
     *
     * @param node the node the rule was offered
     * @return the result
     */
    public static RewriteResult unchanged(PlanNode node) {
        return new RewriteResult(node, false);
    }

    public PlanNode node() {
        return node;
    }

    public boolean changed() {
        return changed;
    }

    @Override
    public String toString() {
        return String.format("RewriteResult(node=%s, changed=%s)", node.id(), changed);
    }
}
