package db.median.exec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import db.median.agg.AggregateContext;
import db.median.agg.AggregateFunction;
import db.median.agg.ArgType;
import db.median.catalog.ColumnSchema;
import db.median.storage.Record;

/**
 * Blocking aggregate: drains its child in open(), folding one column into one state per group,
 * then emits one row per group (group value, result) in first-seen group order.
 * Without a group column it emits exactly one row, NULL when no value was accumulated.
 *
 * All states live in one AggregateContext, closed together with the operator.
 */
public class AggregateOperator<S> implements Operator {
    private final Operator child;
    private final AggregateFunction<S> function;
    private final int argIndex;
    private final ArgType argType;
    private final int groupIndex; // -1: no GROUP BY
    private final List<ColumnSchema> outputSchema;

    private AggregateContext context;
    private Iterator<Map.Entry<Object, S>> groups;

    public AggregateOperator(Operator child, AggregateFunction<S> function, int argIndex, ArgType argType,
                             int groupIndex, String resultName) {
        this.child = child;
        this.function = function;
        this.argIndex = argIndex;
        this.argType = argType;
        this.groupIndex = groupIndex;
        this.outputSchema = buildSchema(child.schema(), resultName);
    }

    private List<ColumnSchema> buildSchema(List<ColumnSchema> childSchema, String resultName) {
        List<ColumnSchema> out = new ArrayList<>(2);
        if (groupIndex >= 0) {
            if (childSchema == null) throw new IllegalStateException("Child schema required for GROUP BY");
            out.add(childSchema.get(groupIndex));
        }
        out.add(new ColumnSchema(resultName, function.resultType(argType.type()), argType.collation()));
        return out;
    }

    @Override
    public void open() {
        context = new AggregateContext(function.name() + " aggregate");
        Map<Object, S> states = new LinkedHashMap<>();
        child.open();
        try {
            Row r;
            while ((r = child.next()) != null) {
                Object key = groupIndex >= 0 ? r.get(groupIndex) : null;
                S state = states.get(key);
                states.put(key, function.accumulate(context, state, r.get(argIndex), argType));
            }
        } catch (RuntimeException e) {
            // a failed accumulate leaves no usable result
            context.close();
            child.close();
            throw e;
        }
        if (groupIndex < 0 && states.isEmpty()) states.put(null, null);
        groups = states.entrySet().iterator();
    }

    @Override
    public Row next() {
        if (groups == null || !groups.hasNext()) return null;
        Map.Entry<Object, S> group = groups.next();
        List<Object> values = new ArrayList<>(2);
        if (groupIndex >= 0) values.add(group.getKey());
        values.add(function.finish(context, group.getValue()));
        return Row.of(new Record(values), outputSchema);
    }

    @Override
    public void close() {
        groups = null;
        if (context != null) context.close();
        child.close();
    }

    @Override
    public List<ColumnSchema> schema() { return outputSchema; }
}
