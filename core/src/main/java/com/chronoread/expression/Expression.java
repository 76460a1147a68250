package com.chronoread.expression;

/**
 * Base interface for all expressions in a predicate tree.
 *
 * <p>Expressions represent the body of a row predicate, such as:
 * <ul>
 *   <li>Literals (constants, regular expressions)</li>
 *   <li>Identifier and member references ({@code r}, {@code r.host})</li>
 *   <li>Comparison operations ({@code r._value > 5}, {@code r.host == "a"})</li>
 *   <li>Logical operations ({@code a and b}, {@code not a})</li>
 *   <li>Function calls ({@code strings.hasPrefix(v: r.host, prefix: "a")})</li>
 * </ul>
 *
 * <p>All concrete implementations are immutable and {@code final}. Rewriting a
 * predicate always builds a new tree, so a tree may be shared freely between
 * plan specifications.
 */
public interface Expression {

    /**
     * Renders this expression in predicate syntax.
     *
     * <p>The rendering is used for explain output and log messages; it is not
     * meant to be parsed back.
     *
     * @return the rendered expression
     */
    String render();
}
