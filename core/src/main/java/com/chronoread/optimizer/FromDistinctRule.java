package com.chronoread.optimizer;

import com.chronoread.plan.Columns;
import com.chronoread.plan.DistinctSpec;
import com.chronoread.plan.GroupMode;
import com.chronoread.plan.PhysicalFromSpec;
import com.chronoread.plan.PlanGraph;
import com.chronoread.plan.ProcedureKind;
import java.util.List;

/**
 * Caps a read to one point per series when a distinct over a group key column
 * sits on top of it.
 *
 * <p>The distinct column is constant within a series when it is part of the
 * series' group key. That holds when
 * <ul>
 *   <li>the read is ungrouped (every tag is in the key) and the column is
 *       neither {@code _value} nor {@code _time}, or</li>
 *   <li>the read is grouped by a key list containing the column, or grouped
 *       except a key list not containing it.</li>
 * </ul>
 * One representative point per series then yields the same distinct values.
 * The distinct node itself stays in place.
 */
public class FromDistinctRule extends ReadRewriteRule<DistinctSpec> {

    public FromDistinctRule() {
        super(ProcedureKind.DISTINCT, DistinctSpec.class);
    }

    @Override
    protected RewriteResult apply(ReadMatch<DistinctSpec> match, PlanGraph graph) {
        PhysicalFromSpec fromSpec = match.readSpec();
        if (fromSpec.isFirstPointOnly()) {
            return RewriteResult.unchanged(match.node());
        }

        String column = match.spec().column();
        List<String> keys = fromSpec.getGroupKeys();
        boolean groupStar = !fromSpec.isGroupingSet()
            && !column.equals(Columns.VALUE)
            && !column.equals(Columns.TIME);
        boolean groupByColumn = fromSpec.isGroupingSet() && !keys.isEmpty()
            && ((fromSpec.getGroupMode() == GroupMode.BY && keys.contains(column))
                || (fromSpec.getGroupMode() == GroupMode.EXCEPT && !keys.contains(column)));

        if (!groupStar && !groupByColumn) {
            return RewriteResult.unchanged(match.node());
        }

        PhysicalFromSpec newFromSpec = fromSpec.copy();
        newFromSpec.setPointsLimit(PhysicalFromSpec.FIRST_POINT_ONLY);
        graph.replaceSpec(match.read(), newFromSpec);
        return RewriteResult.changed(match.node());
    }
}
