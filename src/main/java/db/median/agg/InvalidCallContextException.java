package db.median.agg;

public class InvalidCallContextException extends AggregationException {
    public InvalidCallContextException(String message) {
        super(message);
    }
}
