package db.median.catalog;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

import db.median.storage.MemoryTable;
import db.median.storage.Record;

/**
 * In-memory catalog of tables. Tables can be created programmatically or loaded from a
 * JSON file of the form
 *   {"tables": [{"name": "t", "columns": [{"name": "c", "type": "INT"}], "rows": [[1], [null]]}]}
 * Timestamps are ISO-8601 strings. Table names are case-insensitive.
 */
public class CatalogManager {
    private final Map<String, MemoryTable> tables = new LinkedHashMap<>();

    private final Gson gson = new Gson();

    public MemoryTable createTable(TableSchema schema) {
        String key = key(schema.name());
        if (tables.containsKey(key)) {
            throw new IllegalArgumentException("Table already exists: " + schema.name());
        }
        MemoryTable table = new MemoryTable(schema);
        tables.put(key, table);
        return table;
    }

    public MemoryTable getTable(String name) {
        return tables.get(key(name));
    }

    public TableSchema getTableSchema(String name) {
        MemoryTable t = getTable(name);
        return t != null ? t.schema() : null;
    }

    public Collection<MemoryTable> tables() { return tables.values(); }

    public boolean dropTable(String name) {
        return tables.remove(key(name)) != null;
    }

    /**
     * Load tables from a JSON document. Fails on the first malformed table, value or duplicate name;
     * tables defined before it stay registered.
     * @return number of tables loaded
     */
    public int loadTables(Reader reader) {
        TableFile file;
        try {
            file = gson.fromJson(reader, TableFile.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed table file: " + e.getMessage(), e);
        }
        if (file == null || file.tables == null) return 0;
        int loaded = 0;
        for (TableDef def : file.tables) {
            defineTable(def);
            loaded++;
        }
        return loaded;
    }

    /** Load tables from a file on disk; problems are reported and yield 0. */
    public int loadTables(File file) {
        if (!file.exists()) {
            System.err.println("[CatalogManager] Table file not found: " + file.getPath());
            return 0;
        }
        try (FileReader reader = new FileReader(file, StandardCharsets.UTF_8)) {
            return loadTables(reader);
        } catch (IOException | IllegalArgumentException e) {
            logError("Failed loading table file: " + file.getPath(), e);
            return 0;
        }
    }

    /** Load tables from a classpath resource; problems are reported and yield 0. */
    public int loadTablesResource(String resource) {
        InputStream in = CatalogManager.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            System.err.println("[CatalogManager] Table resource not found: " + resource);
            return 0;
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return loadTables(reader);
        } catch (IOException | IllegalArgumentException e) {
            logError("Failed loading table resource: " + resource, e);
            return 0;
        }
    }

    private void defineTable(TableDef def) {
        if (def.name == null || def.name.isBlank()) throw new IllegalArgumentException("Table without a name");
        if (def.columns == null || def.columns.isEmpty()) {
            throw new IllegalArgumentException("Table '" + def.name + "' has no columns");
        }
        List<ColumnSchema> columns = new ArrayList<>(def.columns.size());
        for (ColumnDef c : def.columns) {
            if (c.name == null) throw new IllegalArgumentException("Column without a name in table '" + def.name + "'");
            columns.add(new ColumnSchema(c.name, DataType.parse(c.type), c.collation));
        }
        MemoryTable table = createTable(new TableSchema(def.name, columns));
        if (def.rows == null) return;
        for (int r = 0; r < def.rows.size(); r++) {
            List<JsonElement> raw = def.rows.get(r);
            if (raw == null || raw.size() != columns.size()) {
                throw new IllegalArgumentException("Row " + r + " of table '" + def.name + "' must have " + columns.size() + " values");
            }
            List<Object> values = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                values.add(convert(raw.get(i), columns.get(i), def.name, r));
            }
            table.insert(new Record(values));
        }
    }

    private static Object convert(JsonElement e, ColumnSchema col, String table, int row) {
        if (e == null || e.isJsonNull()) return null;
        try {
            return switch (col.type()) {
                case SMALLINT -> toShort(integral(e));
                case INT -> Math.toIntExact(integral(e));
                case BIGINT -> integral(e);
                case DOUBLE -> e.getAsDouble();
                case BOOLEAN -> e.getAsBoolean();
                case VARCHAR -> e.getAsString();
                case TIMESTAMP -> LocalDateTime.parse(e.getAsString());
                case TIMESTAMPTZ -> OffsetDateTime.parse(e.getAsString()).toInstant();
            };
        } catch (NumberFormatException | ArithmeticException | DateTimeParseException | UnsupportedOperationException | IllegalStateException ex) {
            throw new IllegalArgumentException("Bad " + col.type() + " value " + e + " for column '" + col.name()
                + "' in row " + row + " of table '" + table + "'", ex);
        }
    }

    // Rejects fractions and values outside the long range instead of truncating them
    private static long integral(JsonElement e) {
        return e.getAsBigDecimal().longValueExact();
    }

    private static short toShort(long v) {
        if (v < Short.MIN_VALUE || v > Short.MAX_VALUE) throw new ArithmeticException("smallint out of range");
        return (short) v;
    }

    private static String key(String name) {
        if (name == null) throw new IllegalArgumentException("Table name must not be null");
        return name.toLowerCase(Locale.ROOT);
    }

    private void logError(String message, Exception e) {
        System.err.println("[CatalogManager] " + message);
        e.printStackTrace(System.err);
    }

    // Gson targets for the table file
    private static final class TableFile {
        List<TableDef> tables;
    }

    private static final class TableDef {
        String name;
        List<ColumnDef> columns;
        List<List<JsonElement>> rows;
    }

    private static final class ColumnDef {
        String name;
        String type;
        String collation;
    }
}
