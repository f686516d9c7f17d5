package db.median.exec;

import java.util.List;

import db.median.catalog.ColumnSchema;

/**
 * Pull-based physical operator.
 */
public interface Operator {
    void open();
    Row next(); // returns next row or null when exhausted
    void close();

    /** Columns of produced rows; null when unknown. */
    default List<ColumnSchema> schema() { return null; }
}
