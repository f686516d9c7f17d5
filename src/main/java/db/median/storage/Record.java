package db.median.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import db.median.catalog.ColumnSchema;

/**
 * One stored row: column values in schema order. Null entries are SQL NULL.
 */
public class Record {
    private final List<Object> values;

    public Record(List<Object> values) {
        // List.of rejects nulls, so copy into a list that allows them
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Record of(Object... values) {
        List<Object> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return new Record(list);
    }

    public List<Object> getValues() {
        return values;
    }

    public Object get(int index) {
        return values.get(index);
    }

    public int size() { return values.size(); }

    /** Check arity and per-column Java types against a schema. */
    public void validate(List<ColumnSchema> columns) {
        if (values.size() != columns.size()) {
            throw new IllegalArgumentException("Record has " + values.size() + " values, schema has " + columns.size() + " columns");
        }
        for (int i = 0; i < columns.size(); i++) {
            ColumnSchema col = columns.get(i);
            Object v = values.get(i);
            if (!col.type().accepts(v)) {
                throw new IllegalArgumentException("Value " + v + " (" + v.getClass().getSimpleName()
                    + ") does not fit column '" + col.name() + "' of type " + col.type());
            }
        }
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
