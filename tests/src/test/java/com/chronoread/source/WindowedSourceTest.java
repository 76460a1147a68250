package com.chronoread.source;

import com.chronoread.exception.QueryExecutionException;
import com.chronoread.time.TimeRange;
import com.chronoread.time.Window;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the windowed streaming source run loop.
 *
 * <p>Every test closes its allocator afterwards, which fails on leaked table
 * memory.
 *
 * <p>Test ID prefix: TC-SOURCE-*
 */
@DisplayName("WindowedSource Tests")
public class WindowedSourceTest {

    private static final DatasetId ID = DatasetId.of("read0");
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(42), ZoneOffset.UTC);
    private static final ReadSpec SPEC = ReadSpec.builder().database("mydb").retentionPolicy("autogen").build();

    private BufferAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new RootAllocator(Long.MAX_VALUE);
    }

    @AfterEach
    void tearDown() {
        allocator.close();
    }

    private WindowedSource source(Reader reader, TimeRange bounds, Window window, ReadErrorPolicy policy) {
        long currentTime = bounds.isEmpty() ? bounds.start() : bounds.start() + window.period();
        return new WindowedSource(ID, reader, SPEC, bounds, window, currentTime, allocator, policy, CLOCK);
    }

    private WindowedSource source(Reader reader, TimeRange bounds, Window window) {
        return source(reader, bounds, window, ReadErrorPolicy.BEST_EFFORT);
    }

    // ==================== Windowing ====================

    @Nested
    @DisplayName("Windowing")
    class Windowing {

        @Test
        @DisplayName("TC-SOURCE-001: Whole-range window reads exactly once")
        void testSingleWindow() {
            TimeRange bounds = new TimeRange(0, 100);
            FakeReader reader = FakeReader.empty();
            RecordingTransformation consumer = new RecordingTransformation("t");
            WindowedSource source = source(reader, bounds, Window.covering(bounds));
            source.addTransformation(consumer);

            source.run(ExecutionContext.anonymous());

            assertThat(reader.windows).containsExactly(new long[] {0, 100});
            assertThat(source.state()).isEqualTo(WindowedSource.State.EXHAUSTED);
            assertThat(source.windowsRead()).isEqualTo(1);
            assertThat(consumer.events).containsExactly("t:watermark:100", "t:finish:ok");
        }

        @Test
        @DisplayName("TC-SOURCE-002: Tumbling windows cover the range without overlap")
        void testTumblingWindows() {
            FakeReader reader = FakeReader.empty();
            RecordingTransformation consumer = new RecordingTransformation("t");
            WindowedSource source = source(reader, new TimeRange(0, 100), new Window(25, 25, 0));
            source.addTransformation(consumer);

            source.run(ExecutionContext.anonymous());

            assertThat(reader.windows).containsExactly(
                new long[] {0, 25}, new long[] {25, 50}, new long[] {50, 75}, new long[] {75, 100});
            assertThat(consumer.events).containsExactly(
                "t:watermark:25", "t:watermark:50", "t:watermark:75", "t:watermark:100", "t:finish:ok");
        }

        @Test
        @DisplayName("TC-SOURCE-003: Window ending past the bounds is not read")
        void testPartialLastWindow() {
            FakeReader reader = FakeReader.empty();
            WindowedSource source = source(reader, new TimeRange(0, 50), new Window(10, 20, 0));

            source.run(ExecutionContext.anonymous());

            assertThat(reader.windows).containsExactly(
                new long[] {0, 20}, new long[] {10, 30}, new long[] {20, 40}, new long[] {30, 50});
        }

        @Test
        @DisplayName("TC-SOURCE-004: Last in-range window before overflow is read exactly once")
        void testOverflow() {
            long max = Long.MAX_VALUE;
            FakeReader reader = FakeReader.empty();
            RecordingTransformation consumer = new RecordingTransformation("t");
            WindowedSource source = source(reader, new TimeRange(max - 200, max), new Window(100, 100, 0));
            source.addTransformation(consumer);

            source.run(ExecutionContext.anonymous());

            assertThat(reader.windows).containsExactly(
                new long[] {max - 200, max - 100}, new long[] {max - 100, max});
            assertThat(source.isOverflow()).isTrue();
            assertThat(source.state()).isEqualTo(WindowedSource.State.EXHAUSTED);
            assertThat(consumer.events).containsExactly(
                "t:watermark:" + (max - 100), "t:watermark:" + max, "t:finish:ok");
        }

        @Test
        @DisplayName("TC-SOURCE-005: Empty bounds read nothing and finish cleanly")
        void testEmptyBounds() {
            FakeReader reader = FakeReader.empty();
            RecordingTransformation consumer = new RecordingTransformation("t");
            WindowedSource source = source(reader, new TimeRange(20, 20), new Window(0, 0, 0));
            source.addTransformation(consumer);

            assertThat(source.state()).isEqualTo(WindowedSource.State.EXHAUSTED);
            source.run(ExecutionContext.anonymous());

            assertThat(reader.windows).isEmpty();
            assertThat(consumer.events).containsExactly("t:finish:ok");
        }

        @Test
        @DisplayName("TC-SOURCE-006: Zero step over non-empty bounds is rejected")
        void testZeroEvery() {
            assertThatThrownBy(() -> source(FakeReader.empty(), new TimeRange(0, 100), new Window(0, 100, 0)))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("TC-SOURCE-007: Context is passed through to the reader")
        void testContextPassedThrough() {
            TimeRange bounds = new TimeRange(0, 100);
            FakeReader reader = FakeReader.empty();
            ExecutionContext ctx = ExecutionContext.forUser(new User("alice"));

            source(reader, bounds, new Window(50, 50, 0)).run(ctx);

            assertThat(reader.contexts).containsOnly(ctx);
            assertThat(reader.specs).containsOnly(SPEC);
        }
    }

    // ==================== Delivery ====================

    @Nested
    @DisplayName("Delivery")
    class Delivery {

        @Test
        @DisplayName("TC-SOURCE-008: Tables reach every consumer in order before the watermark")
        void testOrdering() {
            TimeRange bounds = new TimeRange(0, 100);
            FakeReader reader = new FakeReader((start, stop, alloc) -> TestTables.iterator(Arrays.asList(
                TestTables.table(alloc, "a", 1, 2, 3),
                TestTables.table(alloc, "b", 10))));
            List<String> events = new ArrayList<>();
            RecordingTransformation first = new RecordingTransformation("t1", events);
            RecordingTransformation second = new RecordingTransformation("t2", events);
            WindowedSource source = source(reader, bounds, Window.covering(bounds));
            source.addTransformation(first);
            source.addTransformation(second);

            source.run(ExecutionContext.anonymous());

            assertThat(events).containsExactly(
                "t1:table:a", "t1:heartbeat:42", "t2:table:a", "t2:heartbeat:42",
                "t1:table:b", "t1:heartbeat:42", "t2:table:b", "t2:heartbeat:42",
                "t1:watermark:100", "t2:watermark:100",
                "t1:finish:ok", "t2:finish:ok");
            assertThat(first.rowSums).containsExactly(6L, 10L);
            assertThat(second.rowSums).containsExactly(6L, 10L);
        }

        @Test
        @DisplayName("TC-SOURCE-009: Tables are released once consumed")
        void testTablesReleased() {
            TimeRange bounds = new TimeRange(0, 100);
            List<Table> produced = new ArrayList<>();
            FakeReader reader = new FakeReader((start, stop, alloc) -> {
                Table table = TestTables.table(alloc, "a", start, stop);
                produced.add(table);
                return TestTables.iterator(Arrays.asList(table));
            });
            WindowedSource source = source(reader, bounds, new Window(50, 50, 0));
            source.addTransformation(new RecordingTransformation("t"));

            source.run(ExecutionContext.anonymous());

            assertThat(produced).hasSize(2).allMatch(Table::isClosed);
            assertThat(allocator.getAllocatedMemory()).isZero();
        }

        @Test
        @DisplayName("TC-SOURCE-010: Running twice is rejected")
        void testRunTwice() {
            WindowedSource source = source(FakeReader.empty(), new TimeRange(0, 100), new Window(100, 100, 0));
            RecordingTransformation consumer = new RecordingTransformation("t");
            source.addTransformation(consumer);
            source.run(ExecutionContext.anonymous());

            assertThatThrownBy(() -> source.run(ExecutionContext.anonymous()))
                .isInstanceOf(IllegalStateException.class);
            assertThat(consumer.finishCount).isEqualTo(1);
        }
    }

    // ==================== Failures ====================

    @Nested
    @DisplayName("Failures")
    class Failures {

        private FakeReader failingOnSecondWindow() {
            return new FakeReader((start, stop, alloc) -> {
                if (start >= 25) {
                    throw new IllegalStateException("connection reset");
                }
                return TestTables.iterator(Arrays.asList(TestTables.table(alloc, "a", 1)));
            });
        }

        @Test
        @DisplayName("TC-SOURCE-011: Best effort ends the stream quietly on a read error")
        void testBestEffort() {
            FakeReader reader = failingOnSecondWindow();
            RecordingTransformation consumer = new RecordingTransformation("t");
            WindowedSource source = source(reader, new TimeRange(0, 100), new Window(25, 25, 0));
            source.addTransformation(consumer);

            source.run(ExecutionContext.anonymous());

            assertThat(reader.windows).hasSize(2);
            assertThat(source.windowsRead()).isEqualTo(1);
            assertThat(source.state()).isEqualTo(WindowedSource.State.EXHAUSTED);
            assertThat(consumer.events).containsExactly(
                "t:table:a", "t:heartbeat:42", "t:watermark:25", "t:finish:ok");
            assertThat(consumer.finishErrors).containsExactly((Throwable) null);
        }

        @Test
        @DisplayName("TC-SOURCE-012: Fail fast reports the read error with its window")
        void testFailFast() {
            RecordingTransformation consumer = new RecordingTransformation("t");
            WindowedSource source = source(failingOnSecondWindow(), new TimeRange(0, 100), new Window(25, 25, 0),
                ReadErrorPolicy.FAIL_FAST);
            source.addTransformation(consumer);

            source.run(ExecutionContext.anonymous());

            assertThat(consumer.events).containsExactly(
                "t:table:a", "t:heartbeat:42", "t:watermark:25", "t:finish:error");
            Throwable error = consumer.finishErrors.get(0);
            assertThat(error).isInstanceOf(QueryExecutionException.class)
                .hasRootCauseMessage("connection reset");
            QueryExecutionException qee = (QueryExecutionException) error;
            assertThat(qee.hasWindow()).isTrue();
            assertThat(qee.getWindowStart()).isEqualTo(25);
            assertThat(qee.getWindowStop()).isEqualTo(50);
        }

        @Test
        @DisplayName("TC-SOURCE-013: Consumer error stops the window and is reported")
        void testConsumerError() {
            TimeRange bounds = new TimeRange(0, 100);
            FakeReader reader = new FakeReader((start, stop, alloc) -> TestTables.iterator(Arrays.asList(
                TestTables.table(alloc, "a", 1),
                TestTables.table(alloc, "b", 2))));
            List<String> events = new ArrayList<>();
            RecordingTransformation failing = new RecordingTransformation("bad", events) {
                @Override
                public void processTable(DatasetId id, Table table) {
                    super.processTable(id, table);
                    throw new IllegalArgumentException("cannot handle " + table.key());
                }
            };
            RecordingTransformation other = new RecordingTransformation("ok", events);
            WindowedSource source = source(reader, bounds, new Window(50, 50, 0));
            source.addTransformation(failing);
            source.addTransformation(other);

            source.run(ExecutionContext.anonymous());

            assertThat(reader.windows).hasSize(1);
            assertThat(events).containsExactly("bad:table:a", "bad:finish:error", "ok:finish:error");
            assertThat(failing.finishErrors.get(0))
                .isInstanceOf(QueryExecutionException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
            assertThat(allocator.getAllocatedMemory()).isZero();
        }

        @Test
        @DisplayName("TC-SOURCE-014: A consumer failing to finish does not stop the others")
        void testFinishError() {
            List<String> events = new ArrayList<>();
            RecordingTransformation failing = new RecordingTransformation("bad", events) {
                @Override
                public void finish(DatasetId id, Throwable error) {
                    super.finish(id, error);
                    throw new IllegalStateException("already closed");
                }
            };
            RecordingTransformation other = new RecordingTransformation("ok", events);
            WindowedSource source = source(FakeReader.empty(), new TimeRange(0, 10), new Window(10, 10, 0));
            source.addTransformation(failing);
            source.addTransformation(other);

            source.run(ExecutionContext.anonymous());

            assertThat(events).containsExactly(
                "bad:watermark:10", "ok:watermark:10", "bad:finish:ok", "ok:finish:ok");
        }
    }
}
