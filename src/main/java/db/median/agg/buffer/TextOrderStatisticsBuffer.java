package db.median.agg.buffer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import db.median.agg.RetractNotFoundException;
import db.median.agg.value.ValueClass;

/**
 * Sorted buffer of strings. The ordering is not stored: the caller passes the comparator of
 * its collation to every insert and remove, and must pass the same one each time.
 * Unused slots are kept null so removed strings can be collected.
 */
public final class TextOrderStatisticsBuffer extends OrderStatisticsBuffer {
    private String[] slots;

    public TextOrderStatisticsBuffer() {
        this(DEFAULT_INITIAL_CAPACITY, DEFAULT_MAX_CAPACITY);
    }

    public TextOrderStatisticsBuffer(int initialCapacity, int maxCapacity) {
        super(initialCapacity, maxCapacity);
        this.slots = new String[initialCapacity];
    }

    @Override
    public ValueClass valueClass() { return ValueClass.TEXTUAL; }

    @Override
    public int capacity() { return slots.length; }

    @Override
    protected void reallocate(int newCapacity) {
        slots = Arrays.copyOf(slots, newCapacity);
    }

    /** Insert before the first slot that is not less than value under order. */
    public void insert(String value, Comparator<String> order) {
        if (value == null) throw new IllegalArgumentException("null values are never stored");
        ensureCapacity();
        int pos = 0;
        while (pos < length && order.compare(slots[pos], value) < 0) pos++;
        System.arraycopy(slots, pos, slots, pos + 1, length - pos);
        slots[pos] = value;
        length++;
    }

    /**
     * Remove one slot comparing equal to value under order.
     * @throws RetractNotFoundException if there is none; the buffer is left unchanged
     */
    public void remove(String value, Comparator<String> order) {
        for (int i = 0; i < length; i++) {
            int c = order.compare(slots[i], value);
            if (c == 0) {
                System.arraycopy(slots, i + 1, slots, i, length - i - 1);
                slots[--length] = null;
                return;
            }
            if (c > 0) break;
        }
        throw new RetractNotFoundException("'" + value + "'");
    }

    public Optional<String> median() {
        return isEmpty() ? Optional.empty() : Optional.of(slots[medianIndex()]);
    }

    public String get(int index) {
        if (index < 0 || index >= length) throw new IndexOutOfBoundsException("index " + index + ", length " + length);
        return slots[index];
    }

    public List<String> toList() {
        return new ArrayList<>(Arrays.asList(slots).subList(0, length));
    }

    public boolean isSorted(Comparator<String> order) {
        for (int i = 1; i < length; i++) {
            if (order.compare(slots[i - 1], slots[i]) > 0) return false;
        }
        return true;
    }
}
