package com.chronoread.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility methods for splitting and combining boolean expressions.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Returns true if the expression is a logical AND.
     *
     * @param expr the expression to check
     * @return true for {@code a and b}
     */
    public static boolean isConjunction(Expression expr) {
        return expr instanceof BinaryExpression bin && bin.operator() == BinaryExpression.Operator.AND;
    }

    /**
     * Splits an expression into its top-level AND operands, left to right.
     *
     * <p>{@code (a and b) and (c or d)} splits into {@code [a, b, (c or d)]}.
     * An expression that is not a conjunction yields a single element list.
     *
     * @param expr the expression to split
     * @return the conjuncts in source order
     */
    public static List<Expression> splitConjuncts(Expression expr) {
        List<Expression> conjuncts = new ArrayList<>();
        collectConjuncts(expr, conjuncts);
        return conjuncts;
    }

    private static void collectConjuncts(Expression expr, List<Expression> out) {
        if (isConjunction(expr)) {
            BinaryExpression bin = (BinaryExpression) expr;
            collectConjuncts(bin.left(), out);
            collectConjuncts(bin.right(), out);
        } else {
            out.add(expr);
        }
    }

    /**
     * Joins expressions into a single left-deep conjunction.
     *
     * @param exprs the expressions to join
     * @return the conjunction, the sole expression for a singleton list,
     *         or null for an empty list
     */
    public static Expression conjunction(List<Expression> exprs) {
        Expression result = null;
        for (Expression expr : exprs) {
            result = result == null ? expr : BinaryExpression.and(result, expr);
        }
        return result;
    }

    /**
     * Joins two expressions with AND.
     *
     * @param left the left conjunct
     * @param right the right conjunct
     * @return {@code left and right}
     */
    public static Expression conjunction(Expression left, Expression right) {
        return BinaryExpression.and(left, right);
    }

    /**
     * Rewrites every free reference to identifier {@code from} into {@code to}.
     *
     * <p>Nested functions that declare a parameter named {@code from} shadow it
     * and are left untouched.
     *
     * @param expr the expression
     * @param from the identifier to replace
     * @param to the replacement identifier
     * @return the rewritten expression, or {@code expr} itself if nothing changed
     */
    public static Expression renameIdentifier(Expression expr, String from, String to) {
        if (from.equals(to)) {
            return expr;
        }
        if (expr instanceof IdentifierExpression id) {
            return id.name().equals(from) ? new IdentifierExpression(to) : id;
        }
        if (expr instanceof MemberExpression member) {
            return new MemberExpression(renameIdentifier(member.object(), from, to), member.property());
        }
        if (expr instanceof BinaryExpression bin) {
            return new BinaryExpression(renameIdentifier(bin.left(), from, to), bin.operator(),
                renameIdentifier(bin.right(), from, to));
        }
        if (expr instanceof UnaryExpression unary) {
            return new UnaryExpression(unary.operator(), renameIdentifier(unary.operand(), from, to));
        }
        if (expr instanceof CallExpression call) {
            List<Expression> args = new ArrayList<>(call.arguments().size());
            for (Expression arg : call.arguments()) {
                args.add(renameIdentifier(arg, from, to));
            }
            return new CallExpression(call.callee(), args);
        }
        if (expr instanceof FunctionExpression fn && !fn.parameters().contains(from)) {
            return fn.withBody(renameIdentifier(fn.body(), from, to));
        }
        // Literals and shadowing functions
        return expr;
    }
}
