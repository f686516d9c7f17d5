package db.median.agg;

import java.util.Comparator;
import java.util.OptionalLong;

import db.median.agg.buffer.OrderStatisticsBuffer;
import db.median.agg.value.Collations;
import db.median.agg.value.ValueClass;
import db.median.agg.value.ValueClasses;
import db.median.catalog.DataType;

/**
 * MEDIAN(x) over SMALLINT, INT, BIGINT, TIMESTAMP, TIMESTAMPTZ and VARCHAR.
 *
 * Values are kept fully sorted in a MedianState, so finish() only reads the middle slot:
 * the element at index length / 2. For an even count that is the upper of the two middle
 * elements; nothing is averaged, which also keeps the text case well defined.
 *
 * Usable as a plain aggregate (accumulate + finish) and as a moving aggregate
 * (accumulate + retract + finish, finish called once per output row).
 * Null values are ignored. Every failure is fatal to the aggregation and is raised before
 * the state is changed.
 */
public class MedianAggregate implements MovingAggregateFunction<MedianState> {
    public static final String NAME = "median";

    private final int initialCapacity;
    private final int maxCapacity;

    public MedianAggregate() {
        this(OrderStatisticsBuffer.DEFAULT_INITIAL_CAPACITY, OrderStatisticsBuffer.DEFAULT_MAX_CAPACITY);
    }

    public MedianAggregate(int initialCapacity, int maxCapacity) {
        if (initialCapacity < 2) throw new IllegalArgumentException("initialCapacity must be >= 2 (got " + initialCapacity + ")");
        if (maxCapacity < initialCapacity) throw new IllegalArgumentException("maxCapacity must be >= initialCapacity");
        this.initialCapacity = initialCapacity;
        this.maxCapacity = maxCapacity;
    }

    @Override
    public String name() { return NAME; }

    @Override
    public DataType resultType(DataType argType) {
        ValueClasses.classify(argType);
        return argType;
    }

    @Override
    public MedianState accumulate(AggregateContext ctx, MedianState state, Object value, ArgType arg) {
        checkCall(ctx, state, "median accumulate");
        if (value == null) return state;
        ValueClass valueClass = resolve(state, arg);
        if (valueClass == ValueClass.ORDINAL) {
            long v = ValueClasses.toOrdinal(value, arg.type());
            if (state == null) state = create(ctx, arg.type(), valueClass);
            state.ordinal().insert(v);
        } else {
            String s = ValueClasses.toText(value);
            Comparator<String> order = Collations.comparator(arg.collation());
            if (state == null) state = create(ctx, arg.type(), valueClass);
            state.text().insert(s, order);
        }
        return state;
    }

    @Override
    public MedianState retract(AggregateContext ctx, MedianState state, Object value, ArgType arg) {
        checkCall(ctx, state, "median retract");
        if (value == null) return state;
        if (state == null) throw new RetractNotFoundException(value);
        if (resolve(state, arg) == ValueClass.ORDINAL) {
            state.ordinal().remove(ValueClasses.toOrdinal(value, arg.type()));
        } else {
            state.text().remove(ValueClasses.toText(value), Collations.comparator(arg.collation()));
        }
        return state;
    }

    @Override
    public Object finish(AggregateContext ctx, MedianState state) {
        checkCall(ctx, state, "median finish");
        if (state == null) return null; // no non-null input
        if (state.valueClass() == ValueClass.ORDINAL) {
            OptionalLong m = state.ordinal().median();
            return m.isPresent() ? ValueClasses.fromOrdinal(m.getAsLong(), state.type()) : null;
        }
        return state.text().median().orElse(null);
    }

    private MedianState create(AggregateContext ctx, DataType type, ValueClass valueClass) {
        return ctx.register(new MedianState(ctx, type, valueClass, initialCapacity, maxCapacity));
    }

    // Class of the call's argument; the state, once created, only accepts its own declared type.
    private static ValueClass resolve(MedianState state, ArgType arg) {
        if (arg == null) throw new UnsupportedTypeException("parameter type is unknown");
        ValueClass valueClass = ValueClasses.classify(arg.type());
        if (state != null && state.type() != arg.type()) {
            throw new UnsupportedTypeException("parameter type " + arg.type()
                + " does not match aggregation type " + state.type());
        }
        return valueClass;
    }

    private static void checkCall(AggregateContext ctx, MedianState state, String entryPoint) {
        if (ctx == null) {
            throw new InvalidCallContextException(entryPoint + " called in non-aggregate context");
        }
        ctx.checkLive(entryPoint);
        if (state != null && state.owner() != ctx) {
            throw new InvalidCallContextException(entryPoint + " called with a state from aggregate context '"
                + state.owner().label() + "'");
        }
    }
}
