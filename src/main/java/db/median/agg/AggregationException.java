package db.median.agg;

/**
 * Base of all failures raised by aggregate callbacks.
 * Every subclass is fatal to the running aggregation: the state it was thrown for
 * must not be used to produce a result afterwards.
 */
public class AggregationException extends RuntimeException {
    public AggregationException(String message) {
        super(message);
    }

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
