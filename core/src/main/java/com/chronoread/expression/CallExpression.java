package com.chronoread.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing a function call.
 *
 * <p>Examples:
 * <pre>
 *   strings.hasPrefix(r.host, "web")
 *   math.abs(r._value)
 * </pre>
 *
 * <p>Storage cannot evaluate calls, so any predicate clause containing one
 * stays in the query engine.
 */
public final class CallExpression implements Expression {

    private final String callee;
    private final List<Expression> arguments;

    /**
     * Creates a call expression.
     *
     * @param callee the (possibly package qualified) function name
     * @param arguments the call arguments
     */
    public CallExpression(String callee, List<Expression> arguments) {
        this.callee = Objects.requireNonNull(callee, "callee must not be null");
        if (this.callee.trim().isEmpty()) {
            throw new IllegalArgumentException("callee must not be empty");
        }
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
    }

    public String callee() {
        return callee;
    }

    /**
     * Returns the call arguments.
     *
     * @return an unmodifiable list of arguments
     */
    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public String render() {
        return callee + arguments.stream()
            .map(Expression::render)
            .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CallExpression)) return false;
        CallExpression that = (CallExpression) obj;
        return callee.equals(that.callee) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callee, arguments);
    }
}
