package com.chronoread.expression;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Expression representing a literal constant value.
 *
 * <p>Literals are fixed values that don't change, such as:
 * <ul>
 *   <li>String literals: "host-a"</li>
 *   <li>Integer literals: 42</li>
 *   <li>Float literals: 3.14</li>
 *   <li>Boolean literals: true, false</li>
 *   <li>Regular expression literals: /^cpu[0-9]+$/</li>
 *   <li>Date-time and duration literals: 2024-01-01T00:00:00Z, 5m</li>
 * </ul>
 */
public final class Literal implements Expression {

    /**
     * Literal kinds.
     */
    public enum Kind {
        STRING,
        INTEGER,
        FLOAT,
        BOOLEAN,
        REGEX,
        DATE_TIME,
        DURATION
    }

    private final Object value;
    private final Kind kind;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value
     * @param kind the kind of the literal
     */
    public Literal(Object value, Kind kind) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Returns the literal value.
     *
     * @return the value
     */
    public Object value() {
        return value;
    }

    /**
     * Returns the kind of this literal.
     *
     * @return the kind
     */
    public Kind kind() {
        return kind;
    }

    @Override
    public String render() {
        switch (kind) {
            case STRING:
                return "\"" + value.toString().replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
            case REGEX:
                return "/" + value.toString().replace("/", "\\/") + "/";
            case DURATION:
                return ((Duration) value).toString().substring(2).toLowerCase();
            default:
                return value.toString();
        }
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, kind);
    }

    // ==================== Factory Methods ====================

    public static Literal of(String value) {
        return new Literal(value, Kind.STRING);
    }

    public static Literal of(long value) {
        return new Literal(value, Kind.INTEGER);
    }

    public static Literal of(double value) {
        return new Literal(value, Kind.FLOAT);
    }

    public static Literal of(boolean value) {
        return new Literal(value, Kind.BOOLEAN);
    }

    public static Literal of(Instant value) {
        return new Literal(value, Kind.DATE_TIME);
    }

    public static Literal of(Duration value) {
        return new Literal(value, Kind.DURATION);
    }

    /**
     * Creates a regular expression literal.
     *
     * @param pattern the regular expression source, without delimiters
     * @return the literal expression
     */
    public static Literal regex(String pattern) {
        return new Literal(pattern, Kind.REGEX);
    }
}
