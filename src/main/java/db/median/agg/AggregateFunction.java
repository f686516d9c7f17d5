package db.median.agg;

import db.median.catalog.DataType;

/**
 * Callbacks an engine drives to compute an aggregate over a group of rows.
 * S is the opaque state handle: null until the first value arrives, and always replaced
 * by the handle a callback returns.
 */
public interface AggregateFunction<S> {
    String name();

    /** Result type for an argument of the given type; throws if the type is not supported. */
    DataType resultType(DataType argType);

    /** Fold one row's value (possibly null) into the state. */
    S accumulate(AggregateContext ctx, S state, Object value, ArgType arg);

    /** Current result, or null for SQL NULL. Must not change the state. */
    Object finish(AggregateContext ctx, S state);
}
