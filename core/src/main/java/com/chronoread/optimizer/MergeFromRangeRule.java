package com.chronoread.optimizer;

import com.chronoread.plan.PhysicalFromSpec;
import com.chronoread.plan.PlanGraph;
import com.chronoread.plan.PlanNode;
import com.chronoread.plan.ProcedureKind;
import com.chronoread.plan.RangeSpec;
import com.chronoread.time.Bounds;
import com.chronoread.time.TimeRange;

/**
 * Pushes a range into the physical read below it.
 *
 * <p>On an unbounded read the range's bounds are taken as written. On a read
 * that is already bounded, both intervals are resolved and intersected; an
 * empty intersection is kept and simply reads nothing.
 *
 * <pre>
 *   range(start: -1h) -&gt; physFrom                =&gt;  physFrom[-1h, now)
 *   range([10, 50)) -&gt; physFrom[0, 30)           =&gt;  physFrom[10, 30)
 * </pre>
 */
public class MergeFromRangeRule extends ReadRewriteRule<RangeSpec> {

    public MergeFromRangeRule() {
        super(ProcedureKind.RANGE, RangeSpec.class);
    }

    @Override
    protected RewriteResult apply(ReadMatch<RangeSpec> match, PlanGraph graph) {
        PhysicalFromSpec fromSpec = match.readSpec();
        Bounds rangeBounds = match.spec().bounds();
        PhysicalFromSpec fromRange = fromSpec.copy();

        if (fromSpec.isBoundsSet()) {
            TimeRange intersection = rangeBounds.resolve().intersect(fromSpec.getBounds().resolve());
            fromRange.setBounds(Bounds.of(intersection));
        } else {
            fromRange.setBounds(rangeBounds);
        }

        PlanNode merged = graph.mergeToPhysicalNode(match.node(), match.read(), fromRange);
        return RewriteResult.changed(merged);
    }
}
