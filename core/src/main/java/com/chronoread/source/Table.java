package com.chronoread.source;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * One group of rows read from storage: an Arrow batch plus the group key its
 * rows share.
 *
 * <p>A table owns its {@link VectorSchemaRoot}. Whoever holds the table last
 * closes it; for tables produced by a {@link Reader} that is the source, once
 * every consumer has processed it. Consumers that need the data beyond
 * {@link Transformation#processTable} must copy it.
 */
public final class Table implements AutoCloseable {

    private final Map<String, String> key;
    private final VectorSchemaRoot root;
    private boolean closed = false;

    /**
     * Creates a table.
     *
     * @param key the group key columns and their values
     * @param root the rows, ownership of which passes to the table
     */
    public Table(Map<String, String> key, VectorSchemaRoot root) {
        this.key = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(key, "key must not be null")));
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    /**
     * Returns the group key.
     *
     * @return an unmodifiable map from key column to value, sorted by column
     */
    public Map<String, String> key() {
        return key;
    }

    public VectorSchemaRoot root() {
        return root;
    }

    public int rowCount() {
        return root.getRowCount();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Releases the table's Arrow memory. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        root.close();
    }

    @Override
    public String toString() {
        return String.format("Table(key=%s, rows=%d)", key, root.getRowCount());
    }
}
