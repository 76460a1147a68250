package com.chronoread.plan;

import com.chronoread.expression.FunctionExpression;
import java.util.Objects;

/**
 * Keeps the rows for which a predicate function returns true.
 *
 * <p>Example:
 * <pre>
 *   filter(fn: (r) =&gt; r._measurement == "cpu" and r._value &gt; 90.0)
 * </pre>
 */
public final class FilterSpec implements ProcedureSpec {

    private final FunctionExpression function;

    public FilterSpec(FunctionExpression function) {
        this.function = Objects.requireNonNull(function, "function must not be null");
    }

    /**
     * Returns the predicate function.
     *
     * @return the function
     */
    public FunctionExpression function() {
        return function;
    }

    @Override
    public ProcedureKind kind() {
        return ProcedureKind.FILTER;
    }

    @Override
    public FilterSpec copy() {
        return new FilterSpec(function);
    }

    @Override
    public String toString() {
        return String.format("Filter(%s)", function);
    }
}
