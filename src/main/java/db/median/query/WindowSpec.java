package db.median.query;

// OVER ([PARTITION BY partitionBy] ROWS preceding PRECEDING); preceding == UNBOUNDED for a running aggregate.
public record WindowSpec(String partitionBy, int preceding) {
    public static final int UNBOUNDED = -1;

    public boolean unbounded() { return preceding == UNBOUNDED; }
}
