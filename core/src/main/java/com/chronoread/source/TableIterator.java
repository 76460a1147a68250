package com.chronoread.source;

import java.util.Iterator;

/**
 * Iterator over the tables a {@link Reader} produces for one window.
 *
 * <p>Each {@link Table} returned by {@code next()} is handed over to the
 * caller, which must close it. Closing the iterator releases whatever the
 * reader still holds for the window, including tables not yet returned.
 *
 * <pre>{@code
 * try (TableIterator tables = reader.read(ctx, spec, start, stop, allocator)) {
 *     while (tables.hasNext()) {
 *         try (Table table = tables.next()) {
 *             // process table
 *         }
 *     }
 * }
 * }</pre>
 */
public interface TableIterator extends Iterator<Table>, AutoCloseable {

    /**
     * Closes the iterator and releases its resources. Idempotent.
     */
    @Override
    void close();
}
