package db.median.exec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

import db.median.agg.AggregateContext;
import db.median.agg.ArgType;
import db.median.agg.MovingAggregateFunction;
import db.median.catalog.ColumnSchema;
import db.median.storage.Record;

/**
 * Moving-window aggregate, i.e. f(x) OVER ([PARTITION BY p] ROWS n PRECEDING).
 * Streams its child: every input row is emitted with one extra column holding the aggregate
 * over that row and up to n earlier rows of the same partition, in input order.
 *
 * The frame slides one row at a time: the value leaving the frame is retracted, the new one
 * accumulated, and the result read with finish(). With preceding == UNBOUNDED nothing is
 * ever retracted (running aggregate).
 */
public class WindowAggregateOperator<S> implements Operator {
    public static final int UNBOUNDED = -1;

    private final Operator child;
    private final MovingAggregateFunction<S> function;
    private final int argIndex;
    private final ArgType argType;
    private final int partitionIndex; // -1: single partition
    private final int preceding;
    private final List<ColumnSchema> outputSchema;

    private Map<Object, Frame<S>> frames;

    public WindowAggregateOperator(Operator child, MovingAggregateFunction<S> function, int argIndex, ArgType argType,
                                   int partitionIndex, int preceding, String resultName) {
        if (preceding < UNBOUNDED) throw new IllegalArgumentException("preceding must be >= 0 or UNBOUNDED (got " + preceding + ")");
        List<ColumnSchema> childSchema = child.schema();
        if (childSchema == null) throw new IllegalStateException("Child schema required for window aggregate");
        this.child = child;
        this.function = function;
        this.argIndex = argIndex;
        this.argType = argType;
        this.partitionIndex = partitionIndex;
        this.preceding = preceding;
        this.outputSchema = new ArrayList<>(childSchema);
        this.outputSchema.add(new ColumnSchema(resultName, function.resultType(argType.type()), argType.collation()));
    }

    // Per-partition state: its own context, the aggregate state and the values currently in the frame
    private static final class Frame<S> {
        final AggregateContext context;
        final LinkedList<Object> values = new LinkedList<>(); // may hold nulls
        S state;

        Frame(AggregateContext context) { this.context = context; }
    }

    @Override
    public void open() {
        frames = new HashMap<>();
        child.open();
    }

    @Override
    public Row next() {
        Row r = child.next();
        if (r == null) return null;
        Object key = partitionIndex >= 0 ? r.get(partitionIndex) : null;
        Frame<S> frame = frames.get(key);
        if (frame == null) {
            frame = new Frame<>(new AggregateContext(function.name() + " window partition " + key));
            frames.put(key, frame);
        }
        try {
            if (preceding != UNBOUNDED && frame.values.size() > preceding) {
                frame.state = function.retract(frame.context, frame.state, frame.values.removeFirst(), argType);
            }
            Object value = r.get(argIndex);
            frame.state = function.accumulate(frame.context, frame.state, value, argType);
            // a running frame never retracts, so nothing needs remembering
            if (preceding != UNBOUNDED) frame.values.addLast(value);
        } catch (RuntimeException e) {
            closeFrames();
            throw e;
        }
        List<Object> out = new ArrayList<>(r.values().size() + 1);
        out.addAll(r.values());
        out.add(function.finish(frame.context, frame.state));
        return Row.of(new Record(out), outputSchema);
    }

    @Override
    public void close() {
        closeFrames();
        child.close();
    }

    private void closeFrames() {
        if (frames == null) return;
        for (Frame<S> f : frames.values()) f.context.close();
        frames.clear();
    }

    /** Values currently held for retraction in the given partition; 0 if it has none. */
    int retainedValues(Object partitionKey) {
        if (frames == null) return 0;
        Frame<S> f = frames.get(partitionKey);
        return f == null ? 0 : f.values.size();
    }

    @Override
    public List<ColumnSchema> schema() { return outputSchema; }
}
