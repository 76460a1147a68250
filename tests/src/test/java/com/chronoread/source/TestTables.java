package com.chronoread.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * Builds small Arrow tables and table iterators for source tests.
 */
final class TestTables {

    private TestTables() {}

    /**
     * Creates a table with a single {@code _value} column.
     */
    static Table table(BufferAllocator allocator, String host, long... values) {
        BigIntVector vector = new BigIntVector("_value", allocator);
        vector.allocateNew(values.length);
        for (int i = 0; i < values.length; i++) {
            vector.set(i, values[i]);
        }
        vector.setValueCount(values.length);
        VectorSchemaRoot root = VectorSchemaRoot.of(vector);
        return new Table(Collections.singletonMap("host", host), root);
    }

    static TableIterator iterator(List<Table> tables) {
        return new ListTableIterator(tables);
    }

    static TableIterator empty() {
        return new ListTableIterator(Collections.emptyList());
    }

    /**
     * Iterator over a fixed list; closing it closes the tables not yet handed out.
     */
    static final class ListTableIterator implements TableIterator {
        private final Iterator<Table> it;
        private final List<Table> pending;
        private boolean closed = false;

        ListTableIterator(List<Table> tables) {
            this.pending = new ArrayList<>(tables);
            this.it = new ArrayList<>(tables).iterator();
        }

        @Override
        public boolean hasNext() {
            return !closed && it.hasNext();
        }

        @Override
        public Table next() {
            Table table = it.next();
            pending.remove(table);
            return table;
        }

        boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            for (Table table : pending) {
                table.close();
            }
            pending.clear();
        }
    }
}
