package com.chronoread.time;

/**
 * A windowing schedule over a time range, in nanoseconds.
 *
 * <ul>
 *   <li>{@code every} - distance between the stops of consecutive windows</li>
 *   <li>{@code period} - length of each window</li>
 *   <li>{@code offset} - shift of window boundaries from the epoch</li>
 * </ul>
 */
public final class Window {

    private final long every;
    private final long period;
    private final long offset;

    public Window(long every, long period, long offset) {
        this.every = every;
        this.period = period;
        this.offset = offset;
    }

    /**
     * Creates the window that covers a whole range in exactly one pass.
     *
     * @param range the range, which must not be empty
     * @return a window with {@code every == period == range length}
     */
    public static Window covering(TimeRange range) {
        long duration = TimeMath.span(range.start(), range.stop());
        return new Window(duration, duration, TimeMath.remainder(range.start(), duration));
    }

    public long every() {
        return every;
    }

    public long period() {
        return period;
    }

    public long offset() {
        return offset;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Window)) return false;
        Window that = (Window) obj;
        return every == that.every && period == that.period && offset == that.offset;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(every) * 961 + Long.hashCode(period) * 31 + Long.hashCode(offset);
    }

    @Override
    public String toString() {
        return String.format("Window(every=%d, period=%d, offset=%d)", every, period, offset);
    }
}
