package db.median.catalog;

// Immutable data carrier for a table column.
// collation: only matters for VARCHAR, may be null (engine default is used).
public record ColumnSchema(String name, DataType type, String collation) {
    public ColumnSchema(String name, DataType type) {
        this(name, type, null);
    }
}
