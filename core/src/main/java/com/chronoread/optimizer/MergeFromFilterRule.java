package com.chronoread.optimizer;

import com.chronoread.expression.Expression;
import com.chronoread.expression.ExpressionUtils;
import com.chronoread.expression.FunctionExpression;
import com.chronoread.plan.FilterSpec;
import com.chronoread.plan.PhysicalFromSpec;
import com.chronoread.plan.PlanGraph;
import com.chronoread.plan.PlanNode;
import com.chronoread.plan.ProcedureKind;

/**
 * Pushes the storage-evaluable part of a filter into the physical read below it.
 *
 * <p>Outcomes:
 * <ul>
 *   <li>nothing pushable: no rewrite</li>
 *   <li>everything pushable: the filter disappears into the read</li>
 *   <li>partly pushable: the read takes the pushable conjuncts and the filter
 *       keeps only the residual ones</li>
 * </ul>
 *
 * <p>A read that is already grouped or aggregated is left alone; filtering
 * after those operations is not the same as filtering the raw points.
 *
 * @see PredicatePushdown
 */
public class MergeFromFilterRule extends ReadRewriteRule<FilterSpec> {

    public MergeFromFilterRule() {
        super(ProcedureKind.FILTER, FilterSpec.class);
    }

    @Override
    protected RewriteResult apply(ReadMatch<FilterSpec> match, PlanGraph graph) {
        PlanNode filterNode = match.node();
        PhysicalFromSpec fromSpec = match.readSpec();
        FunctionExpression fn = match.spec().function();

        if (fromSpec.isAggregateSet() || fromSpec.isGroupingSet()) {
            return RewriteResult.unchanged(filterNode);
        }
        if (fn.parameters().size() != 1) {
            // Type checking should rule this out
            return RewriteResult.unchanged(filterNode);
        }

        PredicatePushdown.Partition partition = PredicatePushdown.partition(fn);
        if (partition.pushable().isEmpty()) {
            return RewriteResult.unchanged(filterNode);
        }
        Expression pushable = partition.pushable().get();

        PhysicalFromSpec newFromSpec = fromSpec.copy();
        if (newFromSpec.isFilterSet()) {
            FunctionExpression existing = newFromSpec.getFilter();
            Expression renamed = ExpressionUtils.renameIdentifier(pushable,
                fn.parameters().get(0), existing.parameters().get(0));
            newFromSpec.setFilter(existing.withBody(ExpressionUtils.conjunction(existing.body(), renamed)));
        } else {
            newFromSpec.setFilter(fn.withBody(pushable));
        }

        if (partition.residual().isEmpty()) {
            PlanNode merged = graph.mergeToPhysicalNode(filterNode, match.read(), newFromSpec);
            return RewriteResult.changed(merged);
        }

        graph.replaceSpec(match.read(), newFromSpec);
        graph.replaceSpec(filterNode, new FilterSpec(fn.withBody(partition.residual().get())));
        return RewriteResult.changed(filterNode);
    }
}
