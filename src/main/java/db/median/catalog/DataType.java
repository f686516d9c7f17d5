package db.median.catalog;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Supported column data types and the Java class holding their values.
 * TIMESTAMP is a UTC wall-clock value, TIMESTAMPTZ an absolute instant.
 */
public enum DataType {
    SMALLINT(Short.class),
    INT(Integer.class),
    BIGINT(Long.class),
    TIMESTAMP(LocalDateTime.class),
    TIMESTAMPTZ(Instant.class),
    VARCHAR(String.class),
    BOOLEAN(Boolean.class),
    DOUBLE(Double.class);

    private final Class<?> javaType;

    DataType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> javaType() { return javaType; }

    /** Null is accepted for every type. */
    public boolean accepts(Object value) {
        return value == null || javaType.isInstance(value);
    }

    public static DataType parse(String name) {
        if (name == null) throw new IllegalArgumentException("Column type must not be null");
        String upper = name.trim().toUpperCase(Locale.ROOT);
        return switch (upper) {
            case "INT2" -> SMALLINT;
            case "INTEGER", "INT4" -> INT;
            case "INT8" -> BIGINT;
            case "TEXT" -> VARCHAR;
            case "TIMESTAMP WITH TIME ZONE" -> TIMESTAMPTZ;
            default -> {
                try {
                    yield DataType.valueOf(upper);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Unknown column type: " + name, e);
                }
            }
        };
    }
}
