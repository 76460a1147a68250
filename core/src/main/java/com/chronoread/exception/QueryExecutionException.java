package com.chronoread.exception;

/**
 * Exception thrown when reading from storage or feeding downstream consumers
 * fails while a source is running.
 *
 * <p>Wraps the underlying failure with the time window that was being read so
 * that a truncated scan can be traced back to the storage call that broke it.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       transformation.processTable(id, table);
 *   } catch (QueryExecutionException e) {
 *       logger.error("window [{}, {}) failed", e.getWindowStart(), e.getWindowStop(), e);
 *   }
 * </pre>
 *
 * @see com.chronoread.source.WindowedSource
 */
public class QueryExecutionException extends RuntimeException {

    private final long windowStart;
    private final long windowStop;

    /**
     * Creates a query execution exception that is not tied to a window.
     *
     * @param message the error message
     */
    public QueryExecutionException(String message) {
        super(message);
        this.windowStart = Long.MIN_VALUE;
        this.windowStop = Long.MIN_VALUE;
    }

    /**
     * Creates a query execution exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.windowStart = Long.MIN_VALUE;
        this.windowStop = Long.MIN_VALUE;
    }

    /**
     * Creates a query execution exception for a failed window.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param windowStart the inclusive window start, in nanoseconds
     * @param windowStop the exclusive window stop, in nanoseconds
     */
    public QueryExecutionException(String message, Throwable cause, long windowStart, long windowStop) {
        super(message, cause);
        this.windowStart = windowStart;
        this.windowStop = windowStop;
    }

    /**
     * Returns whether this failure is tied to a specific read window.
     *
     * @return true if the window bounds are available
     */
    public boolean hasWindow() {
        return windowStart != Long.MIN_VALUE || windowStop != Long.MIN_VALUE;
    }

    public long getWindowStart() {
        return windowStart;
    }

    public long getWindowStop() {
        return windowStop;
    }
}
