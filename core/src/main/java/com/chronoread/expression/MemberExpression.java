package com.chronoread.expression;

import java.util.Objects;

/**
 * Expression representing a property access on an object.
 *
 * <p>Inside a row predicate the object is the row parameter and the property
 * is a column of the row:
 * <ul>
 *   <li>Tag columns: {@code r.host}, {@code r._measurement}</li>
 *   <li>The value column: {@code r._value}</li>
 * </ul>
 *
 * <p>Nested access ({@code r.a.b}) is expressed by using another member
 * expression as the object.
 */
public final class MemberExpression implements Expression {

    private final Expression object;
    private final String property;

    /**
     * Creates a member expression.
     *
     * @param object the expression being accessed
     * @param property the property name
     */
    public MemberExpression(Expression object, String property) {
        this.object = Objects.requireNonNull(object, "object must not be null");
        this.property = Objects.requireNonNull(property, "property must not be null");
    }

    /**
     * Creates a member expression on a plain identifier.
     *
     * @param identifier the identifier name, such as the row parameter
     * @param property the property name
     * @return the member expression
     */
    public static MemberExpression of(String identifier, String property) {
        return new MemberExpression(new IdentifierExpression(identifier), property);
    }

    /**
     * Returns the expression being accessed.
     *
     * @return the object expression
     */
    public Expression object() {
        return object;
    }

    /**
     * Returns the property name.
     *
     * @return the property
     */
    public String property() {
        return property;
    }

    /**
     * Returns whether this access is made directly on the named identifier.
     *
     * @param identifier the identifier name
     * @return true for {@code identifier.property}, false for any other object
     */
    public boolean isAccessOn(String identifier) {
        return object instanceof IdentifierExpression id && id.name().equals(identifier);
    }

    @Override
    public String render() {
        return object.render() + "." + property;
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MemberExpression)) return false;
        MemberExpression that = (MemberExpression) obj;
        return object.equals(that.object) && property.equals(that.property);
    }

    @Override
    public int hashCode() {
        return Objects.hash(object, property);
    }
}
