package db.median.agg;

public class AllocationFailureException extends AggregationException {
    public AllocationFailureException(int requestedCapacity, Throwable cause) {
        super("No memory while expanding median buffer to " + requestedCapacity + " slots", cause);
    }
}
