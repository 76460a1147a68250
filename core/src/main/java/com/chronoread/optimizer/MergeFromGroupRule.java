package com.chronoread.optimizer;

import com.chronoread.plan.Columns;
import com.chronoread.plan.GroupMode;
import com.chronoread.plan.GroupSpec;
import com.chronoread.plan.PhysicalFromSpec;
import com.chronoread.plan.PlanGraph;
import com.chronoread.plan.PlanNode;
import com.chronoread.plan.ProcedureKind;

/**
 * Pushes a group-by-keys into the physical read below it.
 *
 * <p>Storage groups only on tag keys, so a group naming {@code _time} or
 * {@code _value} stays in the query engine. {@code _start} and {@code _stop}
 * are fine: storage always groups by them implicitly. Reads that are already
 * grouped or limited are left alone, as are group modes other than
 * {@link GroupMode#BY}.
 */
public class MergeFromGroupRule extends ReadRewriteRule<GroupSpec> {

    public MergeFromGroupRule() {
        super(ProcedureKind.GROUP, GroupSpec.class);
    }

    @Override
    protected RewriteResult apply(ReadMatch<GroupSpec> match, PlanGraph graph) {
        PhysicalFromSpec fromSpec = match.readSpec();
        GroupSpec groupSpec = match.spec();

        if (fromSpec.isGroupingSet() || fromSpec.isLimitSet() || groupSpec.mode() != GroupMode.BY) {
            return RewriteResult.unchanged(match.node());
        }
        for (String key : groupSpec.keys()) {
            if (key.equals(Columns.TIME) || key.equals(Columns.VALUE)) {
                return RewriteResult.unchanged(match.node());
            }
        }

        PhysicalFromSpec newFromSpec = fromSpec.copy();
        newFromSpec.setGrouping(groupSpec.mode(), groupSpec.keys());
        PlanNode merged = graph.mergeToPhysicalNode(match.node(), match.read(), newFromSpec);
        return RewriteResult.changed(merged);
    }
}
