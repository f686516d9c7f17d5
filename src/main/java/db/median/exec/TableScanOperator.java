package db.median.exec;

import java.util.List;

import db.median.catalog.CatalogManager;
import db.median.catalog.ColumnSchema;
import db.median.storage.MemoryTable;

/**
 * Full scan of an in-memory table, in insertion order.
 */
public class TableScanOperator implements Operator {
    private final CatalogManager catalog;
    private final String tableName;

    private MemoryTable table;
    private List<ColumnSchema> columns;
    private int nextRowId;
    private boolean opened;

    public TableScanOperator(CatalogManager catalog, String tableName) {
        this.catalog = catalog;
        this.tableName = tableName;
    }

    @Override
    public void open() {
        table = catalog.getTable(tableName);
        if (table == null) throw new IllegalArgumentException("Unknown table: " + tableName);
        columns = table.schema().columns();
        nextRowId = 0;
        opened = true;
    }

    @Override
    public Row next() {
        if (!opened || nextRowId >= table.size()) return null;
        return Row.of(table.get(nextRowId++), columns);
    }

    @Override
    public void close() {
        opened = false;
        table = null;
    }

    @Override
    public List<ColumnSchema> schema() {
        if (columns != null) return columns;
        MemoryTable t = catalog.getTable(tableName);
        return t != null ? t.schema().columns() : null;
    }
}
