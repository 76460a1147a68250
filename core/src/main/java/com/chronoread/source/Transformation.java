package com.chronoread.source;

import java.time.Instant;

/**
 * A downstream consumer of a source's tables.
 *
 * <p>For every window a source calls {@link #processTable} and
 * {@link #updateProcessingTime} once per table, then
 * {@link #updateWatermark} once. {@link #finish} is called exactly once,
 * after all other calls. Any exception thrown from the first three methods
 * stops the source, which then reports it through {@code finish}.
 */
public interface Transformation {

    /**
     * Consumes a table. The table is only valid for the duration of the call.
     *
     * @param id the producing dataset
     * @param table the table
     */
    void processTable(DatasetId id, Table table);

    /**
     * Heartbeat with the current wall-clock time.
     *
     * @param id the producing dataset
     * @param time the current time
     */
    void updateProcessingTime(DatasetId id, Instant time);

    /**
     * Promises that no more data below {@code watermark} will arrive.
     *
     * @param id the producing dataset
     * @param watermark nanoseconds since the epoch
     */
    void updateWatermark(DatasetId id, long watermark);

    /**
     * Signals that the source is done.
     *
     * @param id the producing dataset
     * @param error the failure that ended the source, or null on success
     */
    void finish(DatasetId id, Throwable error);
}
