package db.median.agg;

/**
 * The argument's declared type (or the Java value supplied for it) has no comparator.
 */
public class UnsupportedTypeException extends AggregationException {
    public UnsupportedTypeException(String message) {
        super(message);
    }
}
