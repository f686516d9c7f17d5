package db.median.query;

import java.util.ArrayList;
import java.util.List;

import db.median.agg.AggregateFunction;
import db.median.agg.ArgType;
import db.median.agg.MovingAggregateFunction;
import db.median.catalog.CatalogManager;
import db.median.catalog.ColumnSchema;
import db.median.catalog.DataType;
import db.median.catalog.FunctionRegistry;
import db.median.catalog.TableSchema;
import db.median.config.MedianConfig;
import db.median.exec.AggregateOperator;
import db.median.exec.Operator;
import db.median.exec.ProjectionOperator;
import db.median.exec.TableScanOperator;
import db.median.exec.WindowAggregateOperator;

/**
 * Builds the physical plan for an AggregateQuery:
 *   plain / grouped:  TableScan -> Aggregate -> Projection
 *   windowed:         TableScan -> WindowAggregate -> Projection
 * Resolves column names and the argument's collation (explicit COLLATE, then the column's,
 * then the configured default).
 */
public class QueryPlanner {
    private final CatalogManager catalog;
    private final FunctionRegistry functions;
    private final MedianConfig config;

    public QueryPlanner(CatalogManager catalog, FunctionRegistry functions, MedianConfig config) {
        this.catalog = catalog;
        this.functions = functions;
        this.config = config;
    }

    public Operator plan(AggregateQuery query) {
        TableSchema ts = catalog.getTableSchema(query.tableName());
        if (ts == null) throw new IllegalArgumentException("Unknown table: " + query.tableName());
        AggregateCall call = query.aggregate();
        int argIndex = resolve(ts, call.argColumn());
        ArgType argType = argType(call, ts.columns().get(argIndex));
        AggregateFunction<?> function = functions.create(call.function());
        // fail at plan time rather than on the first row
        function.resultType(argType.type());
        Operator scan = new TableScanOperator(catalog, ts.name());

        if (call.window() == null) {
            int groupIndex = query.groupBy() != null ? resolve(ts, query.groupBy()) : -1;
            Operator aggregated = aggregate(scan, function, argIndex, argType, groupIndex, call.resultName());
            // aggregate rows are (group, result) or (result); the parser only lets the group column through
            int resultIndex = groupIndex >= 0 ? 1 : 0;
            int[] idxs = new int[query.items().size()];
            for (int i = 0; i < idxs.length; i++) {
                idxs[i] = query.items().get(i).isAggregate() ? resultIndex : 0;
            }
            return new ProjectionOperator(aggregated, idxs);
        }

        if (!(function instanceof MovingAggregateFunction<?> moving)) {
            throw new IllegalArgumentException("Aggregate " + call.function() + " cannot be used with OVER");
        }
        WindowSpec window = call.window();
        int partitionIndex = window.partitionBy() != null ? resolve(ts, window.partitionBy()) : -1;
        int preceding = window.unbounded() ? WindowAggregateOperator.UNBOUNDED : window.preceding();
        Operator windowed = window(scan, moving, argIndex, argType, partitionIndex, preceding, call.resultName());

        int resultIndex = ts.columns().size(); // appended after the table's columns
        List<Integer> idxs = new ArrayList<>();
        for (SelectItem item : query.items()) {
            if (item.isAggregate()) {
                idxs.add(resultIndex);
            } else if (item.isStar()) {
                for (int i = 0; i < ts.columns().size(); i++) idxs.add(i);
            } else {
                idxs.add(resolve(ts, item.column()));
            }
        }
        return new ProjectionOperator(windowed, idxs.stream().mapToInt(Integer::intValue).toArray());
    }

    private ArgType argType(AggregateCall call, ColumnSchema column) {
        if (column.type() != DataType.VARCHAR) {
            if (call.collation() != null) {
                throw new IllegalArgumentException("COLLATE is only valid for VARCHAR columns (column '" + column.name() + "' is " + column.type() + ")");
            }
            return ArgType.of(column.type());
        }
        String collation = call.collation() != null ? call.collation()
            : column.collation() != null ? column.collation()
            : config.defaultCollation;
        return new ArgType(column.type(), collation);
    }

    private static int resolve(TableSchema ts, String column) {
        int idx = ts.indexOf(column);
        if (idx < 0) throw new IllegalArgumentException("Column not found in table '" + ts.name() + "': " + column);
        return idx;
    }

    // Generic helpers capture the function's state type
    private static <S> Operator aggregate(Operator child, AggregateFunction<S> function, int argIndex, ArgType argType,
                                          int groupIndex, String resultName) {
        return new AggregateOperator<>(child, function, argIndex, argType, groupIndex, resultName);
    }

    private static <S> Operator window(Operator child, MovingAggregateFunction<S> function, int argIndex, ArgType argType,
                                       int partitionIndex, int preceding, String resultName) {
        return new WindowAggregateOperator<>(child, function, argIndex, argType, partitionIndex, preceding, resultName);
    }
}
