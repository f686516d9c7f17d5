package db.median.agg;

/**
 * Retraction asked for a value that is not in the buffer.
 * Means the engine retracted something it never accumulated.
 */
public class RetractNotFoundException extends AggregationException {
    public RetractNotFoundException(Object value) {
        super("Value not found during retraction: " + value);
    }
}
