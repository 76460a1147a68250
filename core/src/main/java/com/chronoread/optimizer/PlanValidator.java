package com.chronoread.optimizer;

import com.chronoread.plan.PlanGraph;
import com.chronoread.plan.PlanNode;
import java.util.Objects;

/**
 * Validates physical plans once rewriting is over.
 *
 * <p>Every node's spec gets a chance to reject itself through
 * {@link com.chronoread.plan.ProcedureSpec#postPhysicalValidate}. Nodes are
 * visited in data-flow order, so the error reported is the one closest to
 * the storage reads.
 *
 * <p>Example usage:
 * <pre>
 *   PlanValidator.validate(graph);  // Throws ValidationException if a read is unbounded
 * </pre>
 *
 * @see com.chronoread.exception.ValidationException
 */
public class PlanValidator {

    /**
     * Validates a physical plan.
     *
     * @param graph the plan
     * @throws com.chronoread.exception.ValidationException if a node cannot be executed
     */
    public static void validate(PlanGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        for (PlanNode node : graph.topologicalOrder()) {
            node.spec().postPhysicalValidate(node.id());
        }
    }
}
