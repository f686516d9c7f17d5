package db.median.agg;

// Raised before any slot is touched, so the buffer stays sorted and intact.
public class CapacityOverflowException extends AggregationException {
    private final long requestedCapacity;

    public CapacityOverflowException(int capacity, long requestedCapacity, int maxCapacity) {
        super("Overflow while expanding median buffer: capacity " + capacity
            + " -> " + requestedCapacity + " exceeds maximum " + maxCapacity);
        this.requestedCapacity = requestedCapacity;
    }

    public long requestedCapacity() { return requestedCapacity; }
}
