package db.median.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

import db.median.agg.ArgType;
import db.median.agg.MedianAggregate;
import db.median.catalog.CatalogManager;
import db.median.catalog.ColumnSchema;
import db.median.catalog.DataType;
import db.median.catalog.TableSchema;
import db.median.storage.MemoryTable;
import db.median.storage.Record;

public class WindowAggregateOperatorTest {
    private final CatalogManager catalog = new CatalogManager();

    private MemoryTable table(String name) {
        return catalog.createTable(new TableSchema(name, List.of(
            new ColumnSchema("p", DataType.INT),
            new ColumnSchema("v", DataType.BIGINT)
        )));
    }

    private List<Object> medians(Operator op) {
        List<Object> out = new ArrayList<>();
        op.open();
        Row r;
        while ((r = op.next()) != null) out.add(r.get(r.values().size() - 1));
        op.close();
        return out;
    }

    private WindowAggregateOperator<?> window(String table, int partitionIndex, int preceding) {
        return new WindowAggregateOperator<>(new TableScanOperator(catalog, table), new MedianAggregate(),
            1, ArgType.of(DataType.BIGINT), partitionIndex, preceding, "m");
    }

    @Test
    void frameSlidesOneRowAtATime() {
        MemoryTable t = table("slide");
        for (Long v : Arrays.asList(5L, 3L, 8L, 1L, null, 7L)) t.insert(Record.of(0, v));
        // frames: [5] [5,3] [5,3,8] [3,8,1] [8,1,null] [1,null,7]
        assertEquals(List.of(5L, 5L, 5L, 3L, 8L, 7L), medians(window("slide", -1, 2)));
    }

    @Test
    void rowsArePassedThroughWithResultAppended() {
        MemoryTable t = table("pass");
        t.insert(Record.of(1, 10L));
        t.insert(Record.of(1, 20L));
        WindowAggregateOperator<?> op = window("pass", -1, 0);
        assertEquals(List.of("p", "v", "m"), op.schema().stream().map(ColumnSchema::name).toList());
        op.open();
        assertEquals(List.of(1, 10L, 10L), op.next().values());
        assertEquals(List.of(1, 20L, 20L), op.next().values());
        assertNull(op.next());
        op.close();
    }

    @Test
    void unboundedFrameIsARunningMedian() {
        MemoryTable t = table("running");
        for (long v : new long[] {4, 1, 9, 2}) t.insert(Record.of(0, v));
        // [4] [1,4] [1,4,9] [1,2,4,9]
        assertEquals(List.of(4L, 4L, 4L, 4L), medians(window("running", -1, WindowAggregateOperator.UNBOUNDED)));
    }

    @Test
    void onlyBoundedFramesRetainValues() {
        MemoryTable t = table("retained");
        for (long v = 1; v <= 5; v++) t.insert(Record.of(0, v));

        WindowAggregateOperator<?> running = window("retained", -1, WindowAggregateOperator.UNBOUNDED);
        running.open();
        while (running.next() != null) {
            assertEquals(0, running.retainedValues(null));
        }
        running.close();

        WindowAggregateOperator<?> bounded = window("retained", -1, 1);
        bounded.open();
        bounded.next();
        assertEquals(1, bounded.retainedValues(null));
        bounded.next();
        bounded.next();
        assertEquals(2, bounded.retainedValues(null));
        bounded.close();
    }

    @Test
    void frameWithOnlyNullsYieldsNull() {
        MemoryTable t = table("nulls");
        t.insert(Record.of(0, null));
        t.insert(Record.of(0, 6L));
        t.insert(Record.of(0, null));
        t.insert(Record.of(0, null));
        assertEquals(Arrays.asList(null, 6L, 6L, null), medians(window("nulls", -1, 1)));
    }

    @Test
    void matchesBruteForceMedianPerPartition() {
        MemoryTable t = table("random");
        Random rnd = new Random(2024);
        List<Record> input = new ArrayList<>();
        for (int i = 0; i < 400; i++) {
            Long v = rnd.nextInt(10) == 0 ? null : (long) rnd.nextInt(100);
            Record r = Record.of(rnd.nextInt(3), v);
            input.add(r);
            t.insert(r);
        }
        int preceding = 7;
        List<Object> expected = new ArrayList<>();
        Map<Object, List<Long>> history = new HashMap<>();
        for (Record r : input) {
            List<Long> seen = history.computeIfAbsent(r.get(0), k -> new ArrayList<>());
            seen.add((Long) r.get(1));
            List<Long> frame = new ArrayList<>();
            for (Long v : seen.subList(Math.max(0, seen.size() - preceding - 1), seen.size())) {
                if (v != null) frame.add(v);
            }
            frame.sort(null);
            expected.add(frame.isEmpty() ? null : frame.get(frame.size() / 2));
        }
        assertEquals(expected, medians(window("random", 0, preceding)));
    }

    @Test
    void rejectsNegativeFrame() {
        table("bad");
        assertThrows(IllegalArgumentException.class, () -> window("bad", -1, -2));
    }
}
