package com.chronoread.optimizer;

import com.chronoread.plan.PlanGraph;
import com.chronoread.plan.PlanNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Physical planner that applies rewrite rules to a plan graph.
 *
 * <p>The planner applies rules iteratively until a full pass over the graph
 * changes nothing or a maximum iteration limit is reached. This allows rules
 * to enable each other: converting a read lets a range merge into it, which
 * brings the next operation directly over the read.
 *
 * <p>Each pass walks a snapshot of the graph in data-flow order. A node that
 * a previous rewrite in the same pass removed is skipped. When a rule
 * changes the graph, the remaining rules are offered the node the rule
 * returned.
 *
 * <p>Example usage:
 * <pre>
 *   PhysicalPlanner planner = new PhysicalPlanner();
 *   planner.plan(graph);  // rewrites in place, then validates
 * </pre>
 *
 * @see StorageRules
 * @see PlanValidator
 */
public class PhysicalPlanner {

    private static final Logger logger = LoggerFactory.getLogger(PhysicalPlanner.class);

    private final List<RewriteRule> rules;
    private final int maxIterations;

    /**
     * Creates a planner with the storage rules and the configured pass cap.
     */
    public PhysicalPlanner() {
        this(StorageRules.all(), PlannerConfig.fromSystemProperties());
    }

    /**
     * Creates a planner with custom rules.
     *
     * @param rules the rules to apply, in order
     * @param config the planner configuration
     */
    public PhysicalPlanner(List<RewriteRule> rules, PlannerConfig config) {
        this.rules = new ArrayList<>(Objects.requireNonNull(rules, "rules must not be null"));
        this.maxIterations = Objects.requireNonNull(config, "config must not be null").maxIterations();
    }

    /**
     * Rewrites a plan to a fixed point and validates the result.
     *
     * @param graph the plan, rewritten in place
     * @return the same graph
     * @throws com.chronoread.exception.PlanningException if graph surgery fails
     * @throws com.chronoread.exception.ValidationException if the final plan cannot be executed
     */
    public PlanGraph plan(PlanGraph graph) {
        rewrite(graph);
        PlanValidator.validate(graph);
        return graph;
    }

    /**
     * Rewrites a plan to a fixed point without validating it.
     *
     * @param graph the plan, rewritten in place
     * @return the number of passes that changed the graph
     */
    public int rewrite(PlanGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");

        int changedPasses = 0;
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            if (!rewritePass(graph)) {
                logger.debug("Physical planning reached fixed point after {} changing passes", changedPasses);
                logger.info("Physical plan: {}", graph);
                return changedPasses;
            }
            changedPasses++;
        }

        logger.warn("Physical planning stopped after {} passes without reaching a fixed point", maxIterations);
        return changedPasses;
    }

    private boolean rewritePass(PlanGraph graph) {
        boolean changed = false;
        for (PlanNode start : graph.topologicalOrder()) {
            if (!graph.contains(start)) {
                continue;
            }
            PlanNode node = start;
            for (RewriteRule rule : rules) {
                if (!graph.contains(node) || !rule.pattern().matches(node)) {
                    continue;
                }
                RewriteResult result = rule.rewrite(node, graph);
                if (result.changed()) {
                    logger.debug("Rule {} rewrote {} into {}", rule.name(), node.id(), result.node().id());
                    changed = true;
                    node = result.node();
                }
            }
        }
        return changed;
    }

    /**
     * Returns the list of rewrite rules.
     *
     * @return the rules
     */
    public List<RewriteRule> rules() {
        return new ArrayList<>(rules);
    }

    /**
     * Returns the maximum number of passes.
     *
     * @return the max iterations
     */
    public int maxIterations() {
        return maxIterations;
    }
}
