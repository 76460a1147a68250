package com.chronoread.time;

import java.time.Instant;

/**
 * Arithmetic on signed 64-bit nanosecond timestamps and durations.
 *
 * <p>Time is a fixed-width domain: {@link Long#MIN_VALUE} and
 * {@link Long#MAX_VALUE} nanoseconds since the Unix epoch are the earliest
 * and latest representable instants. Nothing in this class wraps around
 * silently; callers either ask whether an addition would overflow, saturate
 * at the domain edges, or get an {@link ArithmeticException}.
 */
public final class TimeMath {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private TimeMath() {} // Utility class

    /**
     * Returns whether {@code time + delta} falls outside the representable
     * domain in the direction {@code delta} points.
     *
     * @param time the starting timestamp
     * @param delta the signed step
     * @return true if the addition would overflow
     */
    public static boolean addOverflows(long time, long delta) {
        if (delta > 0) {
            return time > Long.MAX_VALUE - delta;
        }
        return time < Long.MIN_VALUE - delta;
    }

    /**
     * Adds a delta, clamping the result to the representable domain.
     *
     * @param time the starting timestamp
     * @param delta the signed step
     * @return the sum, or the domain edge in the direction of travel
     */
    public static long saturatingAdd(long time, long delta) {
        if (addOverflows(time, delta)) {
            return delta > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        return time + delta;
    }

    /**
     * Returns the length of {@code [start, stop)} as a duration.
     *
     * @param start the interval start
     * @param stop the interval stop
     * @return {@code stop - start}
     * @throws ArithmeticException if the span does not fit in a signed 64-bit duration
     */
    public static long span(long start, long stop) {
        return Math.subtractExact(stop, start);
    }

    /**
     * Returns the remainder of a timestamp divided by a duration, with the
     * sign of the timestamp.
     *
     * @param time the timestamp
     * @param duration the divisor, which must not be zero
     * @return {@code time % duration}
     */
    public static long remainder(long time, long duration) {
        if (duration == 0) {
            throw new ArithmeticException("remainder by zero duration");
        }
        return time % duration;
    }

    /**
     * Converts an instant to nanoseconds since the epoch, saturating instants
     * outside the representable domain.
     *
     * @param instant the instant
     * @return nanoseconds since the epoch
     */
    public static long toNanos(Instant instant) {
        long seconds = instant.getEpochSecond();
        if (seconds > Long.MAX_VALUE / NANOS_PER_SECOND) {
            return Long.MAX_VALUE;
        }
        if (seconds < Long.MIN_VALUE / NANOS_PER_SECOND) {
            return Long.MIN_VALUE;
        }
        return saturatingAdd(seconds * NANOS_PER_SECOND, instant.getNano());
    }

    /**
     * Converts nanoseconds since the epoch to an instant.
     *
     * @param nanos nanoseconds since the epoch
     * @return the instant
     */
    public static Instant toInstant(long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND),
            Math.floorMod(nanos, NANOS_PER_SECOND));
    }
}
