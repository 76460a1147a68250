package com.chronoread.optimizer;

import com.chronoread.plan.PhysicalFromSpec;
import com.chronoread.plan.PlanGraph;
import com.chronoread.plan.PlanNode;
import com.chronoread.plan.ProcedureKind;
import com.chronoread.plan.ProcedureSpec;
import java.util.Objects;

/**
 * Base class for rules matching an operation directly over a physical read.
 *
 * <p>Checks the pattern, resolves both nodes into a typed {@link ReadMatch}
 * and hands it to {@link #apply(ReadMatch, PlanGraph)}. A read that feeds
 * more than one consumer is left alone: pushing one branch's operation into
 * it would change what the other branches see.
 *
 * @param <S> the spec type of the operation over the read
 */
public abstract class ReadRewriteRule<S extends ProcedureSpec> implements RewriteRule {

    private final Pattern pattern;
    private final Class<S> specClass;

    /**
     * Creates a rule for {@code kind -> physical read}.
     *
     * @param kind the kind of the operation over the read
     * @param specClass the spec class carried by nodes of that kind
     */
    protected ReadRewriteRule(ProcedureKind kind, Class<S> specClass) {
        this.pattern = Pattern.of(kind, Pattern.of(ProcedureKind.PHYSICAL_FROM));
        this.specClass = Objects.requireNonNull(specClass, "specClass must not be null");
    }

    @Override
    public final Pattern pattern() {
        return pattern;
    }

    @Override
    public final RewriteResult rewrite(PlanNode node, PlanGraph graph) {
        if (!pattern.matches(node)) {
            return RewriteResult.unchanged(node);
        }
        PlanNode read = node.predecessors().get(0);
        if (read.successors().size() != 1) {
            return RewriteResult.unchanged(node);
        }
        ReadMatch<S> match = new ReadMatch<>(node, specClass.cast(node.spec()),
            read, (PhysicalFromSpec) read.spec());
        return apply(match, graph);
    }

    /**
     * Rewrites a matched fragment.
     *
     * @param match the matched operation and read
     * @param graph the graph holding them
     * @return the rewrite outcome
     */
    protected abstract RewriteResult apply(ReadMatch<S> match, PlanGraph graph);
}
