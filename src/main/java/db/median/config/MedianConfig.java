package db.median.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import db.median.agg.buffer.OrderStatisticsBuffer;
import db.median.agg.value.Collations;

/**
 * Engine settings. Read from the classpath resource median.json when present,
 * then overridden by command line flags:
 *   --initial-capacity=N  --max-capacity=N  --collation=ID  --tables=PATH
 */
public class MedianConfig {
    public static final String RESOURCE = "median.json";

    public final int initialCapacity;
    public final int maxCapacity;
    public final String defaultCollation;
    public final String tablesPath; // null -> bundled demo tables

    public MedianConfig(int initialCapacity, int maxCapacity, String defaultCollation, String tablesPath) {
        if (initialCapacity < 2) {
            throw new IllegalArgumentException("initialCapacity must be >= 2 (got " + initialCapacity + ")");
        }
        if (maxCapacity < initialCapacity) {
            throw new IllegalArgumentException("maxCapacity (" + maxCapacity + ") must be >= initialCapacity (" + initialCapacity + ")");
        }
        this.initialCapacity = initialCapacity;
        this.maxCapacity = maxCapacity;
        this.defaultCollation = defaultCollation == null || defaultCollation.isBlank() ? Collations.C : defaultCollation.trim();
        this.tablesPath = tablesPath;
    }

    public static MedianConfig defaults() {
        return new MedianConfig(
                OrderStatisticsBuffer.DEFAULT_INITIAL_CAPACITY,
                OrderStatisticsBuffer.DEFAULT_MAX_CAPACITY,
                Collations.C,
                null
        );
    }

    /** Load median.json from the classpath; defaults if it is missing or unreadable. */
    public static MedianConfig load() {
        InputStream in = MedianConfig.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) return defaults();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        } catch (IOException | JsonParseException | IllegalArgumentException e) {
            logError("Failed loading " + RESOURCE + ", using defaults", e);
            return defaults();
        }
    }

    public static MedianConfig fromJson(Reader reader) {
        Settings s = new Gson().fromJson(reader, Settings.class);
        MedianConfig d = defaults();
        if (s == null) return d;
        return new MedianConfig(
                s.initialCapacity != null ? s.initialCapacity : d.initialCapacity,
                s.maxCapacity != null ? s.maxCapacity : d.maxCapacity,
                s.defaultCollation != null ? s.defaultCollation : d.defaultCollation,
                s.tables
        );
    }

    public MedianConfig withArgs(String[] args) {
        int initial = initialCapacity;
        int max = maxCapacity;
        String collation = defaultCollation;
        String tables = tablesPath;

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--initial-capacity=")) {
                initial = parseInt(s, "--initial-capacity=", initial);
            } else if (s.startsWith("--max-capacity=")) {
                max = parseInt(s, "--max-capacity=", max);
            } else if (s.startsWith("--collation=")) {
                collation = s.substring("--collation=".length());
            } else if (s.startsWith("--tables=")) {
                tables = s.substring("--tables=".length());
            } else {
                System.err.println("[MedianConfig] Ignoring unknown flag: " + s);
            }
        }
        return new MedianConfig(initial, max, collation, tables);
    }

    private static int parseInt(String flag, String prefix, int fallback) {
        String raw = flag.substring(prefix.length());
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            System.err.println("[MedianConfig] Ignoring malformed number in " + flag);
            return fallback;
        }
    }

    private static void logError(String message, Exception e) {
        System.err.println("[MedianConfig] " + message);
        e.printStackTrace(System.err);
    }

    @Override
    public String toString() {
        return "MedianConfig{initialCapacity=" + initialCapacity + ", maxCapacity=" + maxCapacity
            + ", defaultCollation=" + defaultCollation + ", tables=" + tablesPath + "}";
    }

    // Gson target; every field optional
    private static final class Settings {
        Integer initialCapacity;
        Integer maxCapacity;
        String defaultCollation;
        String tables;
    }
}
