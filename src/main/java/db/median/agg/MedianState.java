package db.median.agg;

import java.util.ArrayList;
import java.util.List;

import db.median.agg.buffer.LongOrderStatisticsBuffer;
import db.median.agg.buffer.OrderStatisticsBuffer;
import db.median.agg.buffer.TextOrderStatisticsBuffer;
import db.median.agg.value.ValueClass;
import db.median.agg.value.ValueClasses;
import db.median.catalog.DataType;

/**
 * State handle of one median aggregation: the sorted buffer plus the declared argument type
 * it was created for. Owned by the AggregateContext it was created in; once that context
 * closes the buffer is dropped and the handle is dead.
 * Stays present at length 0 after every value has been retracted.
 */
public final class MedianState implements AggregateContext.Resource {
    private final AggregateContext owner;
    private final DataType type;
    private final ValueClass valueClass;
    private OrderStatisticsBuffer buffer; // null once released

    MedianState(AggregateContext owner, DataType type, ValueClass valueClass, int initialCapacity, int maxCapacity) {
        this.owner = owner;
        this.type = type;
        this.valueClass = valueClass;
        this.buffer = valueClass == ValueClass.ORDINAL
            ? new LongOrderStatisticsBuffer(initialCapacity, maxCapacity)
            : new TextOrderStatisticsBuffer(initialCapacity, maxCapacity);
    }

    public DataType type() { return type; }
    public ValueClass valueClass() { return valueClass; }
    public boolean isReleased() { return buffer == null; }

    public int length() { return live().length(); }
    public int capacity() { return live().capacity(); }

    /** Snapshot of the stored values in ascending order, converted back to the declared type. */
    public List<Object> values() {
        List<Object> out = new ArrayList<>(length());
        if (valueClass == ValueClass.ORDINAL) {
            for (long v : ordinal().toArray()) out.add(ValueClasses.fromOrdinal(v, type));
        } else {
            out.addAll(text().toList());
        }
        return out;
    }

    AggregateContext owner() { return owner; }

    LongOrderStatisticsBuffer ordinal() { return (LongOrderStatisticsBuffer) live(); }

    TextOrderStatisticsBuffer text() { return (TextOrderStatisticsBuffer) live(); }

    private OrderStatisticsBuffer live() {
        if (buffer == null) {
            throw new InvalidCallContextException("median state used after its aggregate context '" + owner.label() + "' was closed");
        }
        return buffer;
    }

    @Override
    public void release() { buffer = null; }

    @Override
    public String toString() {
        if (buffer == null) return "MedianState[" + type + ", released]";
        return "MedianState[" + type + ", length=" + buffer.length() + ", capacity=" + buffer.capacity() + "]";
    }
}
