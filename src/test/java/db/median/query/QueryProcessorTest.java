package db.median.query;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import db.median.agg.UnsupportedTypeException;
import db.median.catalog.CatalogManager;
import db.median.catalog.ColumnSchema;
import db.median.catalog.DataType;
import db.median.catalog.TableSchema;
import db.median.config.MedianConfig;
import db.median.exec.Row;
import db.median.storage.MemoryTable;
import db.median.storage.Record;

public class QueryProcessorTest {
    private final CatalogManager catalog = new CatalogManager();
    private QueryProcessor qp;

    @BeforeEach
    void setUp() {
        assertEquals(2, catalog.loadTablesResource("test-tables.json"));
        qp = new QueryProcessor(catalog, MedianConfig.defaults());
    }

    private Object single(String sql) {
        List<Row> rows = qp.query(sql);
        assertEquals(1, rows.size());
        assertEquals(1, rows.get(0).values().size());
        return rows.get(0).get(0);
    }

    @Test
    void plainMedianSkipsNulls() {
        // 10, 20, 30, 40, 50
        assertEquals(30L, single("SELECT MEDIAN(level) FROM measurements"));
    }

    @Test
    void groupedMedian() {
        List<Row> rows = qp.query("SELECT station, MEDIAN(level) FROM measurements GROUP BY station");
        assertEquals(2, rows.size());
        assertEquals(List.of("A", 30L), rows.get(0).values()); // 10, 30 -> upper
        assertEquals(List.of("B", 40L), rows.get(1).values()); // 20, 40, 50
        assertEquals("median", rows.get(0).schema().get(1).name());
    }

    @Test
    void groupedMedianFollowsSelectListOrder() {
        List<Row> reversed = qp.query("SELECT MEDIAN(level), station FROM measurements GROUP BY station");
        assertEquals(List.of(30L, "A"), reversed.get(0).values());
        assertEquals(List.of(40L, "B"), reversed.get(1).values());
        assertEquals("median", reversed.get(0).schema().get(0).name());
        assertEquals("station", reversed.get(0).schema().get(1).name());

        List<Row> medianOnly = qp.query("SELECT MEDIAN(level) AS m FROM measurements GROUP BY station");
        assertEquals(2, medianOnly.size());
        assertEquals(List.of(30L), medianOnly.get(0).values());
        assertEquals(List.of(40L), medianOnly.get(1).values());
        assertEquals("m", medianOnly.get(0).schema().get(0).name());
    }

    @Test
    void movingMedianProjectsRequestedColumns() {
        List<Object> medians = new ArrayList<>();
        for (Row r : qp.execute("SELECT id, MEDIAN(level) OVER (ROWS 1 PRECEDING) AS m FROM measurements")) {
            assertEquals(2, r.values().size());
            assertEquals("m", r.schema().get(1).name());
            medians.add(r.get(1));
        }
        // [10] [10,40] [40,30] [30,20] [20,null] [null,50]
        assertEquals(List.of(10L, 40L, 40L, 30L, 20L, 50L), medians);
    }

    @Test
    void partitionedMovingMedian() {
        List<Row> rows = qp.query("SELECT station, MEDIAN(level) OVER (PARTITION BY station ROWS 1 PRECEDING) FROM measurements");
        // A: [10] [10,30] [30,null]   B: [40] [40,20] [20,50]
        assertEquals(List.of("A", 10L), rows.get(0).values());
        assertEquals(List.of("B", 40L), rows.get(1).values());
        assertEquals(List.of("A", 30L), rows.get(2).values());
        assertEquals(List.of("B", 40L), rows.get(3).values());
        assertEquals(List.of("A", 30L), rows.get(4).values());
        assertEquals(List.of("B", 50L), rows.get(5).values());
    }

    @Test
    void timestampMedianKeepsItsType() {
        assertEquals(LocalDateTime.parse("2024-01-04T00:00:00"), single("SELECT MEDIAN(reading_at) FROM measurements"));
    }

    @Test
    void textMedianUsesColumnCollationUnlessOverridden() {
        assertEquals("cherry", single("SELECT MEDIAN(w) FROM words"));
        assertEquals("apple", single("SELECT MEDIAN(w COLLATE \"C\") FROM words"));
        assertEquals(Short.valueOf((short) 3), single("SELECT MEDIAN(n) FROM words"));
    }

    @Test
    void defaultCollationAppliesToColumnsWithoutOne() {
        MemoryTable plain = catalog.createTable(new TableSchema("plain", List.of(new ColumnSchema("w", DataType.VARCHAR))));
        for (String s : List.of("apple", "Banana", "cherry", "Date")) plain.insert(Record.of(s));
        assertEquals("apple", single("SELECT MEDIAN(w) FROM plain"));
        QueryProcessor english = new QueryProcessor(catalog, new MedianConfig(64, 1_000, "en-US", null));
        List<Row> rows = english.query("SELECT MEDIAN(w) FROM plain");
        assertEquals("cherry", rows.get(0).get(0));
    }

    @Test
    void errorsSurfaceToTheCaller() {
        assertThrows(UnsupportedTypeException.class, () -> qp.query("SELECT MEDIAN(ratio) FROM measurements"));
        assertThrows(IllegalArgumentException.class, () -> qp.query("SELECT MEDIAN(nope) FROM measurements"));
        assertThrows(IllegalArgumentException.class, () -> qp.query("SELECT MEDIAN(level) FROM missing"));
        assertThrows(IllegalArgumentException.class, () -> qp.query("SELECT AVG(level) FROM measurements"));
        assertThrows(IllegalArgumentException.class, () -> qp.query("SELECT MEDIAN(level COLLATE \"C\") FROM measurements"));
        assertThrows(IllegalArgumentException.class, () -> qp.execute("DELETE FROM measurements"));
    }
}
