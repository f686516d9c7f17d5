package db.median.query;

import java.util.List;

/**
 * Parsed SELECT with exactly one aggregate call. groupBy may be null.
 */
public record AggregateQuery(String tableName, List<SelectItem> items, String groupBy) {
    public AggregateCall aggregate() {
        for (SelectItem item : items) {
            if (item.isAggregate()) return item.aggregate();
        }
        throw new IllegalStateException("Query has no aggregate call");
    }

    public boolean windowed() { return aggregate().window() != null; }
}
