package db.median.agg;

/**
 * Aggregate that can also take a value back out, for frames that slide over the input.
 * Every retract is paired with an earlier accumulate of the same value.
 */
public interface MovingAggregateFunction<S> extends AggregateFunction<S> {
    S retract(AggregateContext ctx, S state, Object value, ArgType arg);
}
