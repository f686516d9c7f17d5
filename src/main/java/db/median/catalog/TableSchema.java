package db.median.catalog;

import java.util.List;

// Immutable data carrier for a table schema.
public record TableSchema(String name, List<ColumnSchema> columns) {
    public int indexOf(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equalsIgnoreCase(columnName)) return i;
        }
        return -1;
    }
}
