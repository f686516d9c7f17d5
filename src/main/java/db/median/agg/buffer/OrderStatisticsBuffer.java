package db.median.agg.buffer;

import db.median.agg.AllocationFailureException;
import db.median.agg.CapacityOverflowException;
import db.median.agg.value.ValueClass;

/**
 * Flat, capacity-tracked array of values kept sorted ascending at all times.
 * Slots [0, length) are occupied and ordered; slots [length, capacity) are unused.
 *
 * Insertion and removal are linear (scan + shift), so filling a buffer of n values
 * costs O(n^2) overall. Fine for moderate window and group sizes; a single flat array
 * keeps the state trivially copyable.
 */
public abstract class OrderStatisticsBuffer {
    public static final int DEFAULT_INITIAL_CAPACITY = 64;
    // Largest array most JVMs will allocate
    public static final int DEFAULT_MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private final int maxCapacity;
    protected int length;

    protected OrderStatisticsBuffer(int initialCapacity, int maxCapacity) {
        if (initialCapacity < 2) {
            throw new IllegalArgumentException("Initial capacity must be >= 2 (got " + initialCapacity + ")");
        }
        if (maxCapacity < initialCapacity) {
            throw new IllegalArgumentException("Max capacity " + maxCapacity + " is below initial capacity " + initialCapacity);
        }
        this.maxCapacity = maxCapacity;
    }

    public abstract ValueClass valueClass();

    /** Allocated slot count. */
    public abstract int capacity();

    /** Occupied slot count. */
    public int length() { return length; }

    public boolean isEmpty() { return length == 0; }

    public int maxCapacity() { return maxCapacity; }

    /**
     * Makes room for one more value, growing capacity by 1.5x when the buffer is full.
     * The last step is clamped to maxCapacity. Fails before touching any slot once the
     * buffer is already at maxCapacity or the new array cannot be allocated.
     */
    public final void ensureCapacity() {
        int capacity = capacity();
        if (length < capacity) return;
        long requested = (long) capacity * 3 / 2;
        if (requested > maxCapacity) {
            if (capacity >= maxCapacity) {
                throw new CapacityOverflowException(capacity, requested, maxCapacity);
            }
            requested = maxCapacity;
        }
        try {
            reallocate((int) requested);
        } catch (OutOfMemoryError e) {
            throw new AllocationFailureException((int) requested, e);
        }
    }

    /** Replace the slot array with one of newCapacity slots holding the same [0, length) prefix. */
    protected abstract void reallocate(int newCapacity);

    // Upper median for even lengths
    protected final int medianIndex() { return length / 2; }
}
