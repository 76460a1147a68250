package com.chronoread.source;

import com.chronoread.exception.QueryExecutionException;
import com.chronoread.time.TimeMath;
import com.chronoread.time.TimeRange;
import com.chronoread.time.Window;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.apache.arrow.memory.BufferAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams a bounded storage read to downstream consumers, one window at a time.
 *
 * <p>The bounds are cut into windows of {@code period} nanoseconds whose stops
 * are {@code every} nanoseconds apart, the first one ending at the current
 * time the source was built with. For each window the source calls the
 * {@link Reader} once and pushes every table it returns through all
 * consumers, in registration order. Each table is followed by a
 * processing-time heartbeat and closed once all consumers have seen it.
 * After the last table of a window every consumer receives a watermark at
 * the window's stop.
 *
 * <h2>States</h2>
 * <ul>
 *   <li><b>RUNNING</b>: more windows may follow</li>
 *   <li><b>EXHAUSTED</b>: the next window would end past the bounds, the
 *       previous window was the last one before the time domain overflows,
 *       or a read failed</li>
 * </ul>
 *
 * <p>When stepping to the next window would overflow the signed 64-bit time
 * domain, the current window is still read; the source becomes exhausted
 * on the following step.
 *
 * <p>{@link #run} may be called once. Every consumer gets exactly one
 * {@link Transformation#finish} call at the end, carrying the failure that
 * stopped the source or null.
 */
public class WindowedSource {

    private static final Logger logger = LoggerFactory.getLogger(WindowedSource.class);

    public enum State {
        RUNNING,
        EXHAUSTED
    }

    private final DatasetId id;
    private final Reader reader;
    private final ReadSpec readSpec;
    private final TimeRange bounds;
    private final Window window;
    private final BufferAllocator allocator;
    private final ReadErrorPolicy readErrorPolicy;
    private final Clock clock;

    private final List<Transformation> transformations = new ArrayList<>();

    private long currentTime;
    private boolean overflow = false;
    private State state;
    private boolean ran = false;
    private int windowsRead = 0;

    /**
     * Creates a source.
     *
     * @param id the dataset the source produces
     * @param reader the storage reader
     * @param readSpec what to read
     * @param bounds the overall time range; an empty range yields no windows
     * @param window the windowing schedule; {@code every} must not be zero
     *        unless the range is empty
     * @param currentTime stop of the first window
     * @param allocator allocator for table memory
     * @param readErrorPolicy what to do when a read fails
     * @param clock source of processing-time heartbeats
     */
    public WindowedSource(DatasetId id, Reader reader, ReadSpec readSpec, TimeRange bounds, Window window,
                          long currentTime, BufferAllocator allocator, ReadErrorPolicy readErrorPolicy,
                          Clock clock) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.readSpec = Objects.requireNonNull(readSpec, "readSpec must not be null");
        this.bounds = Objects.requireNonNull(bounds, "bounds must not be null");
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
        this.readErrorPolicy = Objects.requireNonNull(readErrorPolicy, "readErrorPolicy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.currentTime = currentTime;

        if (bounds.isEmpty()) {
            this.state = State.EXHAUSTED;
        } else {
            if (window.every() == 0) {
                throw new IllegalArgumentException("window every must not be zero: " + window);
            }
            this.state = State.RUNNING;
        }
    }

    /**
     * Registers a downstream consumer. Consumers are fed in registration order.
     *
     * @param transformation the consumer
     */
    public void addTransformation(Transformation transformation) {
        transformations.add(Objects.requireNonNull(transformation, "transformation must not be null"));
    }

    /**
     * Reads all windows and feeds them to the consumers, then finishes every
     * consumer exactly once.
     *
     * @param ctx the query context, passed through to the reader
     * @throws IllegalStateException if the source has already run
     */
    public void run(ExecutionContext ctx) {
        Objects.requireNonNull(ctx, "ctx must not be null");
        if (ran) {
            throw new IllegalStateException("source " + id + " has already run");
        }
        ran = true;

        Throwable error = null;
        try {
            runWindows(ctx);
        } catch (RuntimeException e) {
            logger.error("Source {} failed after {} windows", id, windowsRead, e);
            state = State.EXHAUSTED;
            error = e;
        }

        for (Transformation t : transformations) {
            try {
                t.finish(id, error);
            } catch (RuntimeException e) {
                logger.warn("Consumer of source {} failed to finish", id, e);
            }
        }
        logger.debug("Source {} finished after {} windows", id, windowsRead);
    }

    private void runWindows(ExecutionContext ctx) {
        for (WindowRead read = next(ctx); read != null; read = next(ctx)) {
            processWindow(read);
        }
    }

    /**
     * Steps the state machine: computes the next window, advances the current
     * time and asks the reader for the window's tables.
     *
     * @return the window's tables, or null once the source is exhausted
     */
    private WindowRead next(ExecutionContext ctx) {
        if (state == State.EXHAUSTED) {
            return null;
        }
        if (overflow) {
            state = State.EXHAUSTED;
            return null;
        }

        long start = TimeMath.saturatingAdd(currentTime, -window.period());
        long stop = currentTime;
        if (stop > bounds.stop()) {
            state = State.EXHAUSTED;
            return null;
        }

        // Last window if the step to the next one leaves the time domain
        long every = window.every();
        overflow = TimeMath.addOverflows(currentTime, every);
        currentTime = TimeMath.saturatingAdd(currentTime, every);

        TableIterator tables;
        try {
            tables = Objects.requireNonNull(reader.read(ctx, readSpec, start, stop, allocator),
                "reader returned no tables");
        } catch (RuntimeException e) {
            logger.error("Storage read of window [{}, {}) for source {} failed", start, stop, id, e);
            state = State.EXHAUSTED;
            if (readErrorPolicy == ReadErrorPolicy.FAIL_FAST) {
                throw new QueryExecutionException(
                    String.format("storage read of window [%d, %d) failed: %s", start, stop, e.getMessage()),
                    e, start, stop);
            }
            logger.warn("Ending source {} early after {} windows; results are truncated", id, windowsRead);
            return null;
        }
        windowsRead++;
        logger.debug("Source {} reading window [{}, {})", id, start, stop);
        return new WindowRead(tables, start, stop);
    }

    private void processWindow(WindowRead read) {
        try (TableIterator tables = read.tables) {
            while (tables.hasNext()) {
                try (Table table = tables.next()) {
                    for (Transformation t : transformations) {
                        t.processTable(id, table);
                        t.updateProcessingTime(id, clock.instant());
                    }
                }
            }
            for (Transformation t : transformations) {
                t.updateWatermark(id, read.stop);
            }
        } catch (QueryExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new QueryExecutionException(
                String.format("processing window [%d, %d) failed: %s", read.start, read.stop, e.getMessage()),
                e, read.start, read.stop);
        }
        logger.debug("Source {} advanced watermark to {}", id, read.stop);
    }

    public DatasetId id() {
        return id;
    }

    public State state() {
        return state;
    }

    /**
     * Returns whether the time domain overflow was detected.
     *
     * @return true once stepping past the current window would overflow
     */
    public boolean isOverflow() {
        return overflow;
    }

    /**
     * Returns the stop of the next window to read.
     *
     * @return nanoseconds since the epoch
     */
    public long currentTime() {
        return currentTime;
    }

    public Window window() {
        return window;
    }

    public TimeRange bounds() {
        return bounds;
    }

    public ReadSpec readSpec() {
        return readSpec;
    }

    /**
     * Returns the number of windows the reader was successfully called for.
     *
     * @return the window count
     */
    public int windowsRead() {
        return windowsRead;
    }

    public List<Transformation> transformations() {
        return Collections.unmodifiableList(transformations);
    }

    private static final class WindowRead {
        private final TableIterator tables;
        private final long start;
        private final long stop;

        WindowRead(TableIterator tables, long start, long stop) {
            this.tables = tables;
            this.start = start;
            this.stop = stop;
        }
    }
}
