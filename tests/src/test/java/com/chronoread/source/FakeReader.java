package com.chronoread.source;

import java.util.ArrayList;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;

/**
 * Reader that records every window it is asked for and answers from a
 * callback.
 */
final class FakeReader implements Reader {

    interface WindowHandler {
        TableIterator read(long start, long stop, BufferAllocator allocator);
    }

    final List<long[]> windows = new ArrayList<>();
    final List<ExecutionContext> contexts = new ArrayList<>();
    final List<ReadSpec> specs = new ArrayList<>();
    private final WindowHandler handler;
    boolean closed = false;

    FakeReader(WindowHandler handler) {
        this.handler = handler;
    }

    /**
     * A reader returning no tables for every window.
     */
    static FakeReader empty() {
        return new FakeReader((start, stop, allocator) -> TestTables.empty());
    }

    @Override
    public TableIterator read(ExecutionContext ctx, ReadSpec spec, long start, long stop,
                              BufferAllocator allocator) {
        windows.add(new long[] {start, stop});
        contexts.add(ctx);
        specs.add(spec);
        return handler.read(start, stop, allocator);
    }

    @Override
    public void close() {
        closed = true;
    }
}
