package db.median.exec;

import java.util.List;

import db.median.catalog.ColumnSchema;
import db.median.storage.Record;

/**
 * Row is the execution pipeline unit: a Record plus optional schema metadata.
 */
public class Row {
    private final Record record;
    private final List<ColumnSchema> schema; // can be null

    public static Row of(Record record) { return new Row(record, null); }
    public static Row of(Record record, List<ColumnSchema> schema) { return new Row(record, schema); }

    public Row(Record record, List<ColumnSchema> schema) {
        this.record = record;
        this.schema = schema;
    }

    public Record record() { return record; }
    public List<Object> values() { return record.getValues(); }
    public Object get(int index) { return record.get(index); }
    public List<ColumnSchema> schema() { return schema; }

    @Override
    public String toString() {
        return "Row" + values() + (schema != null ? " schemaCols=" + schema.size() : "");
    }
}
