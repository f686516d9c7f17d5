package db.median.agg.buffer;

import java.util.Arrays;
import java.util.OptionalLong;

import db.median.agg.RetractNotFoundException;
import db.median.agg.value.ValueClass;

/**
 * Sorted buffer of signed 64-bit values (integers and timestamps).
 */
public final class LongOrderStatisticsBuffer extends OrderStatisticsBuffer {
    private long[] slots;

    public LongOrderStatisticsBuffer() {
        this(DEFAULT_INITIAL_CAPACITY, DEFAULT_MAX_CAPACITY);
    }

    public LongOrderStatisticsBuffer(int initialCapacity, int maxCapacity) {
        super(initialCapacity, maxCapacity);
        this.slots = new long[initialCapacity];
    }

    @Override
    public ValueClass valueClass() { return ValueClass.ORDINAL; }

    @Override
    public int capacity() { return slots.length; }

    @Override
    protected void reallocate(int newCapacity) {
        slots = Arrays.copyOf(slots, newCapacity);
    }

    /** Insert before the first slot that is >= value. */
    public void insert(long value) {
        ensureCapacity();
        int pos = 0;
        while (pos < length && slots[pos] < value) pos++;
        System.arraycopy(slots, pos, slots, pos + 1, length - pos);
        slots[pos] = value;
        length++;
    }

    /**
     * Remove one slot equal to value. Equal values are interchangeable, so the first one found goes.
     * @throws RetractNotFoundException if no slot holds value; the buffer is left unchanged
     */
    public void remove(long value) {
        // TODO binary search for the first equal slot once windows get large
        for (int i = 0; i < length; i++) {
            if (slots[i] == value) {
                System.arraycopy(slots, i + 1, slots, i, length - i - 1);
                length--;
                return;
            }
            if (slots[i] > value) break;
        }
        throw new RetractNotFoundException(value);
    }

    public OptionalLong median() {
        return isEmpty() ? OptionalLong.empty() : OptionalLong.of(slots[medianIndex()]);
    }

    public long get(int index) {
        if (index < 0 || index >= length) throw new IndexOutOfBoundsException("index " + index + ", length " + length);
        return slots[index];
    }

    /** Copy of the occupied slots, in order. */
    public long[] toArray() { return Arrays.copyOf(slots, length); }

    public boolean isSorted() {
        for (int i = 1; i < length; i++) {
            if (slots[i - 1] > slots[i]) return false;
        }
        return true;
    }
}
