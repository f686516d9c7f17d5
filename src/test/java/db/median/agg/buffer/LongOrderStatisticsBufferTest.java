package db.median.agg.buffer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import db.median.agg.CapacityOverflowException;
import db.median.agg.RetractNotFoundException;

public class LongOrderStatisticsBufferTest {
    @Test
    void insertKeepsSlotsSorted() {
        LongOrderStatisticsBuffer buf = new LongOrderStatisticsBuffer();
        for (long v : new long[] {5, 3, 8, 1, 3, Long.MIN_VALUE, Long.MAX_VALUE, -7}) buf.insert(v);
        assertArrayEquals(new long[] {Long.MIN_VALUE, -7, 1, 3, 3, 5, 8, Long.MAX_VALUE}, buf.toArray());
        assertTrue(buf.isSorted());
        assertEquals(8, buf.length());
        assertEquals(OrderStatisticsBuffer.DEFAULT_INITIAL_CAPACITY, buf.capacity());
    }

    @Test
    void medianIsElementAtHalfLength() {
        LongOrderStatisticsBuffer odd = new LongOrderStatisticsBuffer();
        for (long v = 5; v >= 1; v--) odd.insert(v);
        assertEquals(3, odd.median().getAsLong());

        LongOrderStatisticsBuffer even = new LongOrderStatisticsBuffer();
        for (long v = 1; v <= 4; v++) even.insert(v);
        assertEquals(3, even.median().getAsLong()); // upper median, index 2
    }

    @Test
    void emptyBufferHasNoMedian() {
        assertTrue(new LongOrderStatisticsBuffer().median().isEmpty());
    }

    @Test
    void growthPreservesExistingValues() {
        LongOrderStatisticsBuffer buf = new LongOrderStatisticsBuffer(4, 1_000);
        for (long v = 10; v >= 1; v--) buf.insert(v);
        // 4 -> 6 -> 9 -> 13
        assertEquals(13, buf.capacity());
        assertArrayEquals(new long[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10}, buf.toArray());
    }

    @Test
    void growthPastMaxCapacityFailsWithoutMutation() {
        LongOrderStatisticsBuffer buf = new LongOrderStatisticsBuffer(4, 6);
        for (long v = 1; v <= 6; v++) buf.insert(v);
        CapacityOverflowException e = assertThrows(CapacityOverflowException.class, () -> buf.insert(0));
        assertEquals(9, e.requestedCapacity());
        assertEquals(6, buf.length());
        assertEquals(6, buf.capacity());
        assertArrayEquals(new long[] {1, 2, 3, 4, 5, 6}, buf.toArray());
    }

    @Test
    void lastGrowthStepIsClampedToMaxCapacity() {
        LongOrderStatisticsBuffer buf = new LongOrderStatisticsBuffer(4, 8);
        // 4 -> 6 -> 8 (9 clamped)
        for (long v = 8; v >= 1; v--) buf.insert(v);
        assertEquals(8, buf.capacity());
        assertEquals(8, buf.length());
        CapacityOverflowException e = assertThrows(CapacityOverflowException.class, () -> buf.insert(9));
        assertEquals(12, e.requestedCapacity());
        assertArrayEquals(new long[] {1, 2, 3, 4, 5, 6, 7, 8}, buf.toArray());
    }

    @Test
    void removeTakesOutOneOfSeveralDuplicates() {
        LongOrderStatisticsBuffer buf = new LongOrderStatisticsBuffer();
        buf.insert(2);
        buf.insert(2);
        buf.insert(1);
        buf.insert(2);
        buf.remove(2);
        assertArrayEquals(new long[] {1, 2, 2}, buf.toArray());
    }

    @Test
    void removeOfMissingValueThrowsAndLeavesBufferIntact() {
        LongOrderStatisticsBuffer buf = new LongOrderStatisticsBuffer();
        buf.insert(1);
        buf.insert(8);
        assertThrows(RetractNotFoundException.class, () -> buf.remove(5));
        assertThrows(RetractNotFoundException.class, () -> buf.remove(9));
        assertArrayEquals(new long[] {1, 8}, buf.toArray());
    }

    @Test
    void bufferIsReusableAfterBeingEmptied() {
        LongOrderStatisticsBuffer buf = new LongOrderStatisticsBuffer();
        buf.insert(4);
        buf.remove(4);
        assertTrue(buf.isEmpty());
        assertTrue(buf.median().isEmpty());
        buf.insert(9);
        assertEquals(9, buf.median().getAsLong());
        assertThrows(IndexOutOfBoundsException.class, () -> buf.get(1));
    }

    @Test
    void rejectsCapacityThatCannotGrow() {
        assertThrows(IllegalArgumentException.class, () -> new LongOrderStatisticsBuffer(1, 10));
        assertThrows(IllegalArgumentException.class, () -> new LongOrderStatisticsBuffer(8, 4));
    }
}
