package db.median.exec;

import java.util.ArrayList;
import java.util.List;

import db.median.catalog.ColumnSchema;
import db.median.storage.Record;

/**
 * Projection operator: selects and reorders columns of child rows by index.
 */
public class ProjectionOperator implements Operator {
    private final Operator child;
    private final int[] columnIndexes; // indices to keep in output order
    private final List<ColumnSchema> projectedSchema; // null if child schema unknown

    public ProjectionOperator(Operator child, int[] columnIndexes) {
        if (columnIndexes.length == 0) throw new IllegalArgumentException("Projection needs at least one column");
        this.child = child;
        this.columnIndexes = columnIndexes.clone();
        List<ColumnSchema> childSchema = child.schema();
        if (childSchema != null) {
            projectedSchema = new ArrayList<>(columnIndexes.length);
            for (int idx : columnIndexes) {
                if (idx < 0 || idx >= childSchema.size()) {
                    throw new IllegalArgumentException("Projection index " + idx + " outside child schema of " + childSchema.size() + " columns");
                }
                projectedSchema.add(childSchema.get(idx));
            }
        } else {
            projectedSchema = null;
        }
    }

    @Override
    public void open() { child.open(); }

    @Override
    public Row next() {
        Row r = child.next();
        if (r == null) return null;
        List<Object> projected = new ArrayList<>(columnIndexes.length);
        for (int idx : columnIndexes) {
            projected.add(r.get(idx));
        }
        return Row.of(new Record(projected), projectedSchema);
    }

    @Override
    public void close() { child.close(); }

    @Override
    public List<ColumnSchema> schema() { return projectedSchema; }
}
