package db.median.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.StringReader;
import org.junit.jupiter.api.Test;

import db.median.agg.buffer.OrderStatisticsBuffer;

public class MedianConfigTest {
    @Test
    void defaultsMatchBufferDefaults() {
        MedianConfig d = MedianConfig.defaults();
        assertEquals(OrderStatisticsBuffer.DEFAULT_INITIAL_CAPACITY, d.initialCapacity);
        assertEquals(OrderStatisticsBuffer.DEFAULT_MAX_CAPACITY, d.maxCapacity);
        assertEquals("C", d.defaultCollation);
        assertNull(d.tablesPath);
    }

    @Test
    void bundledResourceLoads() {
        MedianConfig c = MedianConfig.load();
        assertEquals(64, c.initialCapacity);
        assertEquals("C", c.defaultCollation);
    }

    @Test
    void jsonFieldsAreOptional() {
        MedianConfig c = MedianConfig.fromJson(new StringReader("{\"initialCapacity\": 16, \"tables\": \"data/t.json\"}"));
        assertEquals(16, c.initialCapacity);
        assertEquals(OrderStatisticsBuffer.DEFAULT_MAX_CAPACITY, c.maxCapacity);
        assertEquals("data/t.json", c.tablesPath);
        assertEquals(MedianConfig.defaults().initialCapacity, MedianConfig.fromJson(new StringReader("")).initialCapacity);
    }

    @Test
    void argsOverrideAndMalformedNumbersAreIgnored() {
        MedianConfig c = MedianConfig.defaults().withArgs(new String[] {
            "--initial-capacity=8", "--max-capacity=lots", "--collation=en-US", "--tables=x.json", "--verbose"
        });
        assertEquals(8, c.initialCapacity);
        assertEquals(OrderStatisticsBuffer.DEFAULT_MAX_CAPACITY, c.maxCapacity);
        assertEquals("en-US", c.defaultCollation);
        assertEquals("x.json", c.tablesPath);
    }

    @Test
    void rejectsCapacitiesThatCannotGrow() {
        assertThrows(IllegalArgumentException.class, () -> new MedianConfig(1, 10, null, null));
        assertThrows(IllegalArgumentException.class, () -> new MedianConfig(64, 32, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> MedianConfig.defaults().withArgs(new String[] {"--initial-capacity=0"}));
    }
}
