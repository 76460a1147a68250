package com.chronoread.optimizer;

import com.chronoread.plan.KeysSpec;
import com.chronoread.plan.PhysicalFromSpec;
import com.chronoread.plan.PlanGraph;
import com.chronoread.plan.ProcedureKind;

/**
 * Caps a read to one point per series when only its keys are listed.
 */
public class FromKeysRule extends ReadRewriteRule<KeysSpec> {

    public FromKeysRule() {
        super(ProcedureKind.KEYS, KeysSpec.class);
    }

    @Override
    protected RewriteResult apply(ReadMatch<KeysSpec> match, PlanGraph graph) {
        PhysicalFromSpec fromSpec = match.readSpec();
        if (fromSpec.isFirstPointOnly()) {
            return RewriteResult.unchanged(match.node());
        }

        PhysicalFromSpec newFromSpec = fromSpec.copy();
        newFromSpec.setPointsLimit(PhysicalFromSpec.FIRST_POINT_ONLY);
        graph.replaceSpec(match.read(), newFromSpec);
        return RewriteResult.changed(match.node());
    }
}
