package com.chronoread.source;

import org.apache.arrow.memory.BufferAllocator;

/**
 * Reads series data from storage. The only I/O boundary of a source.
 *
 * <p>A source calls {@link #read} once per window, with disjoint
 * {@code [start, stop)} pairs that together cover the read's bounds.
 * Implementations should honor {@link ExecutionContext#isCancelled()}.
 */
public interface Reader extends AutoCloseable {

    /**
     * Reads one window.
     *
     * @param ctx the query context
     * @param spec what to read
     * @param start window start in nanoseconds since the epoch, inclusive
     * @param stop window stop in nanoseconds since the epoch, exclusive
     * @param allocator allocator for the returned tables' memory
     * @return the tables of the window
     * @throws RuntimeException if the storage call fails
     */
    TableIterator read(ExecutionContext ctx, ReadSpec spec, long start, long stop, BufferAllocator allocator);

    @Override
    void close();
}
