package db.median.query;

import java.util.List;
import java.util.Locale;

import db.median.catalog.CatalogManager;
import db.median.catalog.FunctionRegistry;
import db.median.config.MedianConfig;
import db.median.exec.Operator;
import db.median.exec.Row;

/**
 * Processor combining parsing, planning, and streaming execution.
 */
public class QueryProcessor {
    private final QueryParser parser = new QueryParser();
    private final QueryPlanner planner;
    private final QueryExecutor executor = new QueryExecutor();

    public QueryProcessor(CatalogManager catalog, FunctionRegistry functions, MedianConfig config) {
        this.planner = new QueryPlanner(catalog, functions, config);
    }

    public QueryProcessor(CatalogManager catalog, MedianConfig config) {
        this(catalog, FunctionRegistry.withDefaults(config), config);
    }

    public Operator plan(String sql) {
        return planner.plan(parser.parse(sql));
    }

    /** Streams result rows; the query runs while the Iterable is consumed. */
    public Iterable<Row> execute(String sql) {
        if (sql == null) throw new IllegalArgumentException("sql must not be null");
        String trimmed = sql.trim();
        if (!trimmed.toUpperCase(Locale.ROOT).startsWith("SELECT")) {
            throw new IllegalArgumentException("Unrecognized statement (expected SELECT): " + sql);
        }
        return executor.stream(plan(trimmed));
    }

    public List<Row> query(String sql) {
        if (sql == null) throw new IllegalArgumentException("sql must not be null");
        return executor.collect(plan(sql));
    }
}
