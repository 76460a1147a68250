package com.chronoread.optimizer;

import com.chronoread.plan.FromSpec;
import com.chronoread.plan.PhysicalFromSpec;
import com.chronoread.plan.PlanGraph;
import com.chronoread.plan.PlanNode;
import com.chronoread.plan.ProcedureKind;

/**
 * Converts a logical read into an unbounded physical read.
 *
 * <p>Every read enters physical planning through this rule. The physical read
 * it produces has no bounds yet; a range must be merged into it later or the
 * plan fails validation.
 */
public class FromConversionRule implements RewriteRule {

    private static final Pattern PATTERN = Pattern.of(ProcedureKind.FROM);

    @Override
    public Pattern pattern() {
        return PATTERN;
    }

    @Override
    public RewriteResult rewrite(PlanNode node, PlanGraph graph) {
        if (!PATTERN.matches(node)) {
            return RewriteResult.unchanged(node);
        }
        FromSpec logical = (FromSpec) node.spec();
        PlanNode physical = graph.replaceNode(node, new PhysicalFromSpec(logical));
        return RewriteResult.changed(physical);
    }
}
