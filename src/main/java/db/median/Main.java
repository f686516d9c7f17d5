package db.median;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Scanner;

import db.median.catalog.CatalogManager;
import db.median.catalog.ColumnSchema;
import db.median.cli.TablePrinter;
import db.median.config.MedianConfig;
import db.median.exec.Row;
import db.median.query.QueryProcessor;
import db.median.storage.MemoryTable;

public class Main {
    static final String DEMO_TABLES = "demo-tables.json";

    public static void main(String[] args) {
        MedianConfig config = MedianConfig.load().withArgs(args);
        var catalog = new CatalogManager();
        int loaded = config.tablesPath != null
            ? catalog.loadTables(new File(config.tablesPath))
            : catalog.loadTablesResource(DEMO_TABLES);
        System.out.println("Loaded " + loaded + " table(s)\n");
        printTables(catalog);

        QueryProcessor qp = new QueryProcessor(catalog, config);
        runExamples(qp);

        System.out.println("Query mode (type 'tables' to list tables, 'exit' to quit)\n");
        try (Scanner scanner = new Scanner(System.in)) {
            while (true) {
                System.out.print("sql> ");
                if (!scanner.hasNextLine()) break;
                String line = scanner.nextLine().trim();
                if (line.equalsIgnoreCase("exit")) {
                    System.out.println("Exiting query mode");
                    break;
                }
                if (line.isEmpty()) continue;
                if (line.equalsIgnoreCase("tables")) {
                    printTables(catalog);
                    continue;
                }
                run(qp, line);
            }
        }
    }

    private static void runExamples(QueryProcessor qp) {
        for (String sql : List.of(
            "SELECT MEDIAN(temp) FROM readings",
            "SELECT sensor, MEDIAN(temp) FROM readings GROUP BY sensor",
            "SELECT id, temp, MEDIAN(temp) OVER (ROWS 2 PRECEDING) AS moving FROM readings"
        )) {
            System.out.println("sql> " + sql);
            run(qp, sql);
            System.out.println();
        }
    }

    private static void run(QueryProcessor qp, String sql) {
        try {
            List<Row> rows = new ArrayList<>();
            for (Row r : qp.execute(sql)) rows.add(r);
            TablePrinter.print(rows);
        } catch (Exception ex) {
            System.out.println("Error: " + ex.getMessage());
        }
    }

    private static void printTables(CatalogManager catalog) {
        for (MemoryTable t : catalog.tables()) {
            StringBuilder sb = new StringBuilder("  ").append(t.schema().name()).append('(');
            List<ColumnSchema> cols = t.schema().columns();
            for (int i = 0; i < cols.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(cols.get(i).name()).append(' ').append(cols.get(i).type());
                if (cols.get(i).collation() != null) sb.append(" COLLATE \"").append(cols.get(i).collation()).append('"');
            }
            sb.append(") ").append(t.size()).append(" row(s)");
            System.out.println(sb);
        }
        System.out.println();
    }
}

/* -------------------------------------------------------------------------
 * Example queries (MEDIAN over SMALLINT, INT, BIGINT, TIMESTAMP, TIMESTAMPTZ, VARCHAR)
 * Tables (demo-tables.json):
 *   readings(id INT, sensor VARCHAR, temp INT, taken_at TIMESTAMPTZ)
 *   cities(name VARCHAR COLLATE "en-US", country VARCHAR, founded SMALLINT)
 *
 * Plain and grouped:
 * 1. SELECT MEDIAN(temp) FROM readings
 * 2. SELECT sensor, MEDIAN(taken_at) FROM readings GROUP BY sensor
 * 3. SELECT MEDIAN(name COLLATE "C") FROM cities
 *
 * Moving window (the frame slides in table order):
 * 1. SELECT id, MEDIAN(temp) OVER (ROWS 3 PRECEDING) FROM readings
 * 2. SELECT *, MEDIAN(temp) OVER (PARTITION BY sensor ROWS 1 PRECEDING) AS m FROM readings
 * 3. SELECT name, MEDIAN(founded) OVER (ROWS UNBOUNDED PRECEDING) FROM cities
 * ------------------------------------------------------------------------- */
