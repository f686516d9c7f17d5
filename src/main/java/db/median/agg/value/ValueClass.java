package db.median.agg.value;

/**
 * Comparison strategy of an aggregation, fixed by the first non-null value it sees.
 */
public enum ValueClass {
    /** Handled as signed 64-bit integers (integer types and timestamps). */
    ORDINAL,
    /** Handled as strings ordered by a collation. */
    TEXTUAL
}
