package com.chronoread.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a predicate function.
 *
 * <p>Row filters are written as single-parameter functions whose body is a
 * boolean expression over the parameter:
 * <pre>
 *   (r) =&gt; r._measurement == "cpu" and r._value &gt; 90.0
 * </pre>
 *
 * <p>Functions are immutable; {@link #withBody(Expression)} is how a rewrite
 * narrows or extends a predicate without touching the original.
 */
public final class FunctionExpression implements Expression {

    private final List<String> parameters;
    private final Expression body;

    /**
     * Creates a function expression.
     *
     * @param parameters the parameter names
     * @param body the function body
     */
    public FunctionExpression(List<String> parameters, Expression body) {
        this.parameters = new ArrayList<>(Objects.requireNonNull(parameters, "parameters must not be null"));
        this.body = Objects.requireNonNull(body, "body must not be null");
    }

    /**
     * Creates a single-parameter predicate function.
     *
     * @param parameter the row parameter name
     * @param body the predicate body
     * @return the function expression
     */
    public static FunctionExpression predicate(String parameter, Expression body) {
        return new FunctionExpression(Collections.singletonList(parameter), body);
    }

    /**
     * Returns the parameter names.
     *
     * @return an unmodifiable list of parameter names
     */
    public List<String> parameters() {
        return Collections.unmodifiableList(parameters);
    }

    public Expression body() {
        return body;
    }

    /**
     * Returns a function with the same parameters and a different body.
     *
     * @param newBody the new body
     * @return a new function expression
     */
    public FunctionExpression withBody(Expression newBody) {
        return new FunctionExpression(parameters, newBody);
    }

    @Override
    public String render() {
        return "(" + String.join(", ", parameters) + ") => " + body.render();
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionExpression)) return false;
        FunctionExpression that = (FunctionExpression) obj;
        return parameters.equals(that.parameters) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameters, body);
    }
}
