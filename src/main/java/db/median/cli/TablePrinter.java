package db.median.cli;

import java.io.PrintStream;
import java.util.List;

import db.median.catalog.ColumnSchema;
import db.median.exec.Row;

/**
 * ASCII table printer for query result rows.
 * Uses schema metadata when available for headers; SQL NULL prints as NULL.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(List<Row> rows) { print(rows, System.out); }

    public static void print(List<Row> rows, PrintStream out) {
        out.print(render(rows));
    }

    public static String render(List<Row> rows) {
        if (rows == null || rows.isEmpty()) {
            return "(0 row(s))" + System.lineSeparator();
        }
        Row first = rows.get(0);
        List<ColumnSchema> schema = first.schema();
        int colCount = first.values().size();
        String[] headers = new String[colCount];
        for (int i = 0; i < colCount; i++) {
            headers[i] = schema != null ? schema.get(i).name() : ("col" + (i + 1));
        }
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) widths[i] = headers[i].length();
        for (Row r : rows) {
            for (int i = 0; i < colCount; i++) {
                widths[i] = Math.max(widths[i], cell(r.get(i)).length());
            }
        }
        String nl = System.lineSeparator();
        String divider = divider(widths);
        StringBuilder sb = new StringBuilder();
        sb.append(divider).append(nl);
        sb.append(line(headers, widths)).append(nl);
        sb.append(divider).append(nl);
        String[] cells = new String[colCount];
        for (Row r : rows) {
            for (int i = 0; i < colCount; i++) cells[i] = cell(r.get(i));
            sb.append(line(cells, widths)).append(nl);
        }
        sb.append(divider).append(nl);
        sb.append('(').append(rows.size()).append(" row(s))").append(nl);
        return sb.toString();
    }

    static String cell(Object value) {
        return value == null ? "NULL" : String.valueOf(value);
    }

    private static String divider(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int w : widths) sb.append("-".repeat(w + 2)).append('+');
        return sb.toString();
    }

    private static String line(String[] cells, int[] widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < cells.length; i++) {
            sb.append(' ').append(cells[i]).append(" ".repeat(widths[i] - cells[i].length())).append(" |");
        }
        return sb.toString();
    }
}
