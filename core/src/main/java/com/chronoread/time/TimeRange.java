package com.chronoread.time;

/**
 * A resolved, absolute half-open interval {@code [start, stop)} in epoch
 * nanoseconds.
 */
public final class TimeRange {

    private final long start;
    private final long stop;

    public TimeRange(long start, long stop) {
        this.start = start;
        this.stop = stop;
    }

    public long start() {
        return start;
    }

    public long stop() {
        return stop;
    }

    /**
     * Returns whether the interval contains no instant.
     *
     * @return true if {@code stop <= start}
     */
    public boolean isEmpty() {
        return stop <= start;
    }

    /**
     * Intersects two intervals.
     *
     * <p>The narrower bound wins on each side. Disjoint intervals produce an
     * empty interval positioned at the later start rather than an error.
     *
     * @param other the other interval
     * @return the intersection
     */
    public TimeRange intersect(TimeRange other) {
        long newStart = Math.max(start, other.start);
        long newStop = Math.min(stop, other.stop);
        if (newStop < newStart) {
            newStop = newStart;
        }
        return new TimeRange(newStart, newStop);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TimeRange)) return false;
        TimeRange that = (TimeRange) obj;
        return start == that.start && stop == that.stop;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(start) * 31 + Long.hashCode(stop);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + stop + ")";
    }
}
