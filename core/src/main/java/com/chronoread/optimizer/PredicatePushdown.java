package com.chronoread.optimizer;

import com.chronoread.expression.BinaryExpression;
import com.chronoread.expression.Expression;
import com.chronoread.expression.ExpressionUtils;
import com.chronoread.expression.FunctionExpression;
import com.chronoread.expression.Literal;
import com.chronoread.expression.MemberExpression;
import com.chronoread.plan.Columns;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which parts of a row predicate the storage layer can evaluate.
 *
 * <p>A predicate is split on its top-level {@code and}s. Each conjunct is
 * pushable when it has the form {@code <param>.<property> <op> <literal>}:
 * <ul>
 *   <li>the literal is a string, integer, float, boolean or regular expression
 *       and sits on the right-hand side</li>
 *   <li>the left-hand side is a property of exactly the row parameter</li>
 *   <li>for tag properties, {@code op} is one of {@code == != =~ !~}</li>
 *   <li>for the value property ({@code _value}), {@code op} may additionally
 *       be one of {@code < <= > >=}</li>
 * </ul>
 *
 * <p>A conjunct containing {@code or} or {@code not} is never pushable as a
 * whole, even if its parts would be. Pushable conjuncts are rejoined into one
 * conjunction, as are the rest.
 *
 * <p>Example with row parameter {@code r}:
 * <pre>
 *   r._value &gt; 5 and r.host == "a" and (r.dc == "x" or r.dc == "y")
 *     pushable: r._value &gt; 5 and r.host == "a"
 *     residual: r.dc == "x" or r.dc == "y"
 * </pre>
 */
public final class PredicatePushdown {

    private static final Set<Literal.Kind> PUSHABLE_LITERALS = EnumSet.of(
        Literal.Kind.STRING,
        Literal.Kind.INTEGER,
        Literal.Kind.BOOLEAN,
        Literal.Kind.FLOAT,
        Literal.Kind.REGEX);

    private static final Set<BinaryExpression.Operator> TAG_OPERATORS = EnumSet.of(
        BinaryExpression.Operator.EQUAL,
        BinaryExpression.Operator.NOT_EQUAL,
        BinaryExpression.Operator.REGEX_MATCH,
        BinaryExpression.Operator.REGEX_NOT_MATCH);

    private static final Set<BinaryExpression.Operator> FIELD_OPERATORS = EnumSet.of(
        BinaryExpression.Operator.EQUAL,
        BinaryExpression.Operator.NOT_EQUAL,
        BinaryExpression.Operator.REGEX_MATCH,
        BinaryExpression.Operator.REGEX_NOT_MATCH,
        BinaryExpression.Operator.LESS_THAN,
        BinaryExpression.Operator.LESS_THAN_OR_EQUAL,
        BinaryExpression.Operator.GREATER_THAN,
        BinaryExpression.Operator.GREATER_THAN_OR_EQUAL);

    private PredicatePushdown() {}

    /**
     * A predicate split into the part storage evaluates and the part that
     * stays in the query engine.
     */
    public static final class Partition {

        private final Expression pushable;
        private final Expression residual;

        Partition(Expression pushable, Expression residual) {
            this.pushable = pushable;
            this.residual = residual;
        }

        /**
         * Returns the conjunction storage can evaluate.
         *
         * @return the pushable predicate, or empty if nothing can be pushed
         */
        public Optional<Expression> pushable() {
            return Optional.ofNullable(pushable);
        }

        /**
         * Returns the conjunction that must stay in the query engine.
         *
         * @return the residual predicate, or empty if everything can be pushed
         */
        public Optional<Expression> residual() {
            return Optional.ofNullable(residual);
        }

        @Override
        public String toString() {
            return String.format("Partition(pushable=%s, residual=%s)", pushable, residual);
        }
    }

    /**
     * Splits the body of a predicate function.
     *
     * <p>Functions that do not declare exactly one parameter are not analyzed
     * and come back wholly residual.
     *
     * @param function the predicate function
     * @return the partition
     */
    public static Partition partition(FunctionExpression function) {
        if (function.parameters().size() != 1) {
            return new Partition(null, function.body());
        }
        return partition(function.parameters().get(0), function.body());
    }

    /**
     * Splits a predicate over the given row parameter.
     *
     * @param paramName the name of the row parameter
     * @param expr the predicate
     * @return the partition
     */
    public static Partition partition(String paramName, Expression expr) {
        List<Expression> pushable = new ArrayList<>();
        List<Expression> residual = new ArrayList<>();
        for (Expression conjunct : ExpressionUtils.splitConjuncts(expr)) {
            if (isPushable(paramName, conjunct)) {
                pushable.add(conjunct);
            } else {
                residual.add(conjunct);
            }
        }
        return new Partition(ExpressionUtils.conjunction(pushable), ExpressionUtils.conjunction(residual));
    }

    /**
     * Determines whether storage can evaluate a whole predicate expression.
     *
     * @param paramName the name of the row parameter
     * @param expr the expression
     * @return true if the expression can be pushed down as is
     */
    public static boolean isPushable(String paramName, Expression expr) {
        if (!(expr instanceof BinaryExpression)) {
            return false;
        }
        BinaryExpression bin = (BinaryExpression) expr;
        switch (bin.operator()) {
            case AND:
                return isPushable(paramName, bin.left()) && isPushable(paramName, bin.right());
            case OR:
                return false;
            default:
                return isPushablePredicate(paramName, bin);
        }
    }

    private static boolean isPushablePredicate(String paramName, BinaryExpression bin) {
        // Storage only handles <param>.<property> <op> <literal>, literal on the right.
        if (!isLiteral(bin.right())) {
            return false;
        }
        if (!(bin.left() instanceof MemberExpression)) {
            return false;
        }
        MemberExpression member = (MemberExpression) bin.left();
        if (!member.isAccessOn(paramName)) {
            return false;
        }
        if (Columns.VALUE.equals(member.property())) {
            return FIELD_OPERATORS.contains(bin.operator());
        }
        return TAG_OPERATORS.contains(bin.operator());
    }

    private static boolean isLiteral(Expression expr) {
        return expr instanceof Literal lit && PUSHABLE_LITERALS.contains(lit.kind());
    }
}
