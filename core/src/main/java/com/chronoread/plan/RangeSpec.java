package com.chronoread.plan;

import com.chronoread.time.Bounds;
import java.util.Objects;

/**
 * Restricts rows to a time interval.
 */
public final class RangeSpec implements ProcedureSpec {

    private final Bounds bounds;

    public RangeSpec(Bounds bounds) {
        this.bounds = Objects.requireNonNull(bounds, "bounds must not be null");
    }

    public Bounds bounds() {
        return bounds;
    }

    @Override
    public ProcedureKind kind() {
        return ProcedureKind.RANGE;
    }

    @Override
    public RangeSpec copy() {
        return new RangeSpec(bounds);
    }

    @Override
    public String toString() {
        return String.format("Range(%s)", bounds);
    }
}
