package db.median.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import db.median.catalog.TableSchema;

/**
 * Heap of records kept in insertion order. Scans see rows in that order, which is
 * also the order moving-window aggregates slide over.
 */
public class MemoryTable {
    private final TableSchema schema;
    private final List<Record> records = new ArrayList<>();

    public MemoryTable(TableSchema schema) {
        this.schema = schema;
    }

    public TableSchema schema() { return schema; }

    /** Returns the row number of the inserted record. */
    public int insert(Record record) {
        record.validate(schema.columns());
        records.add(record);
        return records.size() - 1;
    }

    public int size() { return records.size(); }

    public Record get(int rowId) { return records.get(rowId); }

    public List<Record> records() { return Collections.unmodifiableList(records); }
}
