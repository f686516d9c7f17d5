package db.median.query;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQL parser for aggregate SELECTs:
 *   SELECT [g,] f(c [COLLATE coll]) [AS a] FROM t [GROUP BY g]
 *   SELECT cols|*, f(c [COLLATE coll]) OVER ([PARTITION BY p] ROWS n|UNBOUNDED PRECEDING) [AS a] FROM t
 * Keywords are case-insensitive, a trailing ';' is allowed. No WHERE, no joins, one aggregate per query.
 */
public class QueryParser {
    private static final String IDENT = "[a-zA-Z_][a-zA-Z0-9_]*";

    private static final Pattern SELECT_PATTERN = Pattern.compile(
        // Groups:
        // 1: select list
        // 2: table name
        // 3: optional GROUP BY column
        "^SELECT\\s+(.+?)\\s+FROM\\s+(" + IDENT + ")" +
        "(?:\\s+GROUP\\s+BY\\s+(" + IDENT + "))?\\s*;?$",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );

    private static final Pattern AGGREGATE_PATTERN = Pattern.compile(
        // Groups:
        // 1: function name
        // 2: argument column
        // 3: optional collation ("x", 'x' or bare)
        // 4: optional OVER clause body
        // 5: optional alias
        "^(" + IDENT + ")\\s*\\(\\s*(" + IDENT + ")(?:\\s+COLLATE\\s+(\"[^\"]*\"|'[^']*'|[a-zA-Z0-9_-]+))?\\s*\\)" +
        "(?:\\s+OVER\\s*\\((.*)\\))?" +
        "(?:\\s+AS\\s+(" + IDENT + "))?$",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );

    private static final Pattern WINDOW_PATTERN = Pattern.compile(
        // 1: optional partition column, 2: frame size or UNBOUNDED
        "^\\s*(?:PARTITION\\s+BY\\s+(" + IDENT + ")\\s+)?ROWS\\s+(\\d+|UNBOUNDED)\\s+PRECEDING\\s*$",
        Pattern.CASE_INSENSITIVE
    );

    private static final Pattern COLUMN_PATTERN = Pattern.compile("^" + IDENT + "$");

    public AggregateQuery parse(String sql) {
        if (sql == null) throw new IllegalArgumentException("sql must not be null");
        Matcher m = SELECT_PATTERN.matcher(sql.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Malformed SELECT: " + sql);
        }
        String listPart = m.group(1).trim();
        String tableName = m.group(2);
        String groupBy = m.group(3);

        List<SelectItem> items = new ArrayList<>();
        for (String raw : splitTopLevel(listPart)) {
            items.add(parseItem(raw.trim()));
        }

        long aggregates = items.stream().filter(SelectItem::isAggregate).count();
        if (aggregates != 1) {
            throw new IllegalArgumentException("Exactly one aggregate call is supported per query (found " + aggregates + ")");
        }
        AggregateQuery query = new AggregateQuery(tableName, items, groupBy);
        if (query.windowed()) {
            if (groupBy != null) throw new IllegalArgumentException("GROUP BY cannot be combined with OVER");
        } else {
            for (SelectItem item : items) {
                if (item.isAggregate()) continue;
                if (groupBy == null || !item.column().equalsIgnoreCase(groupBy)) {
                    throw new IllegalArgumentException("Column '" + item.column() + "' must appear in GROUP BY");
                }
            }
        }
        return query;
    }

    private SelectItem parseItem(String raw) {
        if (raw.isEmpty()) throw new IllegalArgumentException("Empty select item");
        if (raw.equals("*")) return SelectItem.star();
        if (COLUMN_PATTERN.matcher(raw).matches()) return SelectItem.column(raw);
        Matcher m = AGGREGATE_PATTERN.matcher(raw);
        if (!m.matches()) throw new IllegalArgumentException("Unsupported select item: " + raw);
        String collation = m.group(3) != null ? unquote(m.group(3)) : null;
        WindowSpec window = m.group(4) != null ? parseWindow(m.group(4)) : null;
        return SelectItem.aggregate(new AggregateCall(m.group(1), m.group(2), collation, window, m.group(5)));
    }

    private WindowSpec parseWindow(String body) {
        Matcher m = WINDOW_PATTERN.matcher(body);
        if (!m.matches()) throw new IllegalArgumentException("Unsupported window clause: OVER (" + body.trim() + ")");
        String frame = m.group(2);
        int preceding;
        if (frame.equalsIgnoreCase("UNBOUNDED")) {
            preceding = WindowSpec.UNBOUNDED;
        } else {
            try {
                preceding = Integer.parseInt(frame);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Frame size out of range: " + frame, e);
            }
        }
        return new WindowSpec(m.group(1), preceding);
    }

    private static String unquote(String raw) {
        if (raw.length() >= 2 && (raw.startsWith("\"") && raw.endsWith("\"") || raw.startsWith("'") && raw.endsWith("'"))) {
            return raw.substring(1, raw.length() - 1);
        }
        return raw;
    }

    // Split on commas that are not inside parentheses or quotes.
    private static List<String> splitTopLevel(String list) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        StringBuilder cur = new StringBuilder();
        for (int i = 0; i < list.length(); i++) {
            char c = list.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) throw new IllegalArgumentException("Unbalanced ')' in select list");
            } else if (c == ',' && depth == 0) {
                parts.add(cur.toString());
                cur.setLength(0);
                continue;
            }
            cur.append(c);
        }
        if (depth != 0 || quote != 0) throw new IllegalArgumentException("Unterminated select list: " + list);
        parts.add(cur.toString());
        return parts;
    }
}
