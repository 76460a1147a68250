package com.chronoread.optimizer;

import com.chronoread.plan.PlanGraph;
import com.chronoread.plan.PlanNode;

/**
 * Interface for physical plan rewrite rules.
 *
 * <p>A rule declares the {@link Pattern} it applies to. The driver offers the
 * rule every node that matches the pattern; the rule either rewrites the
 * graph around that node or declines.
 *
 * <p>Rules must:
 * <ul>
 *   <li>never mutate a spec still held by the graph; copy it, change the copy,
 *       and hand the copy to the graph</li>
 *   <li>decline with {@link RewriteResult#unchanged(PlanNode)} when a rewrite
 *       would be unsafe, rather than throwing</li>
 *   <li>be idempotent: once applied, offering the rule the same fragment again
 *       must report no change</li>
 * </ul>
 *
 * <p>Graph surgery failures propagate as {@link com.chronoread.exception.PlanningException}
 * and abort planning.
 */
public interface RewriteRule {

    /**
     * Returns the pattern this rule applies to.
     *
     * @return the pattern
     */
    Pattern pattern();

    /**
     * Rewrites the graph around a node matching {@link #pattern()}.
     *
     * @param node the anchor node of the match
     * @param graph the graph holding the node
     * @return the rewrite outcome
     */
    RewriteResult rewrite(PlanNode node, PlanGraph graph);

    /**
     * Returns the name of this rule.
     *
     * <p>Used for logging and debugging.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
