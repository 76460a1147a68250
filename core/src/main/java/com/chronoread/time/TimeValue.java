package com.chronoread.time;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A point in time as written in a query: either an absolute timestamp or an
 * offset relative to the query's reference "now".
 *
 * <p>Examples:
 * <pre>
 *   TimeValue.absolute(Instant.parse("2024-01-01T00:00:00Z"))
 *   TimeValue.relative(Duration.ofHours(-1))     -- one hour before now
 *   TimeValue.now()                              -- now itself
 * </pre>
 */
public final class TimeValue {

    private static final TimeValue NOW = new TimeValue(true, 0L);

    private final boolean relative;
    private final long nanos;

    private TimeValue(boolean relative, long nanos) {
        this.relative = relative;
        this.nanos = nanos;
    }

    public static TimeValue absolute(long epochNanos) {
        return new TimeValue(false, epochNanos);
    }

    public static TimeValue absolute(Instant instant) {
        return absolute(TimeMath.toNanos(Objects.requireNonNull(instant, "instant must not be null")));
    }

    public static TimeValue relative(long offsetNanos) {
        return new TimeValue(true, offsetNanos);
    }

    public static TimeValue relative(Duration offset) {
        Objects.requireNonNull(offset, "offset must not be null");
        return relative(offset.toNanos());
    }

    public static TimeValue now() {
        return NOW;
    }

    public boolean isRelative() {
        return relative;
    }

    /**
     * Returns the absolute timestamp or relative offset, in nanoseconds.
     *
     * @return the raw nanosecond value
     */
    public long nanos() {
        return nanos;
    }

    /**
     * Returns whether this is the zero instant: an absolute time at the epoch.
     * A relative value is never zero, even with a zero offset.
     *
     * @return true for the zero instant
     */
    public boolean isZero() {
        return !relative && nanos == 0L;
    }

    /**
     * Resolves this value to an absolute timestamp.
     *
     * @param now the reference instant for relative values
     * @return nanoseconds since the epoch
     */
    public long resolve(Instant now) {
        if (!relative) {
            return nanos;
        }
        Objects.requireNonNull(now, "now must not be null for a relative time");
        return TimeMath.saturatingAdd(TimeMath.toNanos(now), nanos);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TimeValue)) return false;
        TimeValue that = (TimeValue) obj;
        return relative == that.relative && nanos == that.nanos;
    }

    @Override
    public int hashCode() {
        return Objects.hash(relative, nanos);
    }

    @Override
    public String toString() {
        if (relative) {
            return nanos == 0L ? "now()" : Duration.ofNanos(nanos).toString();
        }
        return TimeMath.toInstant(nanos).toString();
    }
}
