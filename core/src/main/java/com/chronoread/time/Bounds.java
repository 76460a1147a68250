package com.chronoread.time;

import java.time.Instant;
import java.util.Objects;

/**
 * Time bounds as specified by a range operation: a start, a stop and the
 * reference instant relative values are resolved against.
 */
public final class Bounds {

    private final TimeValue start;
    private final TimeValue stop;
    private final Instant now;

    /**
     * Creates bounds.
     *
     * @param start the inclusive start
     * @param stop the exclusive stop
     * @param now the reference instant (may be null when both ends are absolute)
     */
    public Bounds(TimeValue start, TimeValue stop, Instant now) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.stop = Objects.requireNonNull(stop, "stop must not be null");
        this.now = now;
    }

    /**
     * Creates absolute bounds.
     *
     * @param start inclusive start, in epoch nanoseconds
     * @param stop exclusive stop, in epoch nanoseconds
     * @return the bounds
     */
    public static Bounds absolute(long start, long stop) {
        return new Bounds(TimeValue.absolute(start), TimeValue.absolute(stop), null);
    }

    /**
     * Creates absolute bounds from a resolved range.
     *
     * @param range the range
     * @return the bounds
     */
    public static Bounds of(TimeRange range) {
        return absolute(range.start(), range.stop());
    }

    public TimeValue start() {
        return start;
    }

    public TimeValue stop() {
        return stop;
    }

    public Instant now() {
        return now;
    }

    /**
     * Returns whether both ends are the zero instant, which is how unset
     * bounds look.
     *
     * @return true if start and stop are both zero
     */
    public boolean isZero() {
        return start.isZero() && stop.isZero();
    }

    /**
     * Resolves both ends against the reference instant.
     *
     * @return the absolute range
     */
    public TimeRange resolve() {
        return new TimeRange(start.resolve(now), stop.resolve(now));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Bounds)) return false;
        Bounds that = (Bounds) obj;
        return start.equals(that.start) && stop.equals(that.stop) && Objects.equals(now, that.now);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, stop, now);
    }

    @Override
    public String toString() {
        return String.format("Bounds(start=%s, stop=%s, now=%s)", start, stop, now);
    }
}
