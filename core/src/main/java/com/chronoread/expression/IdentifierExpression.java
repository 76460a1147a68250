package com.chronoread.expression;

import java.util.Objects;

/**
 * Expression referencing a name in scope, typically the row parameter of a
 * predicate function.
 */
public final class IdentifierExpression implements Expression {

    private final String name;

    public IdentifierExpression(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
    }

    public String name() {
        return name;
    }

    @Override
    public String render() {
        return name;
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IdentifierExpression)) return false;
        return name.equals(((IdentifierExpression) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
