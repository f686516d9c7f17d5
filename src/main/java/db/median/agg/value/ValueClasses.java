package db.median.agg.value;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import db.median.agg.UnsupportedTypeException;
import db.median.catalog.DataType;

/**
 * Maps declared argument types to a ValueClass and converts Java values to and from
 * their ordinal (64-bit) representation.
 * Timestamps are stored as microseconds since the Unix epoch, so sub-microsecond
 * precision is dropped on entry.
 */
public final class ValueClasses {
    private static final long MICROS_PER_SECOND = 1_000_000L;
    private static final int NANOS_PER_MICRO = 1_000;

    private ValueClasses() {}

    public static ValueClass classify(DataType type) {
        if (type == null) throw new UnsupportedTypeException("parameter type is unknown");
        return switch (type) {
            case SMALLINT, INT, BIGINT, TIMESTAMP, TIMESTAMPTZ -> ValueClass.ORDINAL;
            case VARCHAR -> ValueClass.TEXTUAL;
            default -> throw new UnsupportedTypeException("parameter type " + type + " not supported");
        };
    }

    public static long toOrdinal(Object value, DataType type) {
        switch (type) {
            case SMALLINT:
                return checkedRange(integral(value, type), Short.MIN_VALUE, Short.MAX_VALUE, type);
            case INT:
                return checkedRange(integral(value, type), Integer.MIN_VALUE, Integer.MAX_VALUE, type);
            case BIGINT:
                return integral(value, type);
            case TIMESTAMP:
                if (value instanceof LocalDateTime ldt) return epochMicros(ldt.toInstant(ZoneOffset.UTC));
                throw mismatch(value, type);
            case TIMESTAMPTZ:
                if (value instanceof Instant instant) return epochMicros(instant);
                throw mismatch(value, type);
            default:
                throw new UnsupportedTypeException("parameter type " + type + " is not ordinal");
        }
    }

    /** Inverse of {@link #toOrdinal}: result carries the declared type of the argument. */
    public static Object fromOrdinal(long ordinal, DataType type) {
        return switch (type) {
            case SMALLINT -> (short) ordinal;
            case INT -> (int) ordinal;
            case BIGINT -> ordinal;
            case TIMESTAMP -> LocalDateTime.ofInstant(instantOf(ordinal), ZoneOffset.UTC);
            case TIMESTAMPTZ -> instantOf(ordinal);
            default -> throw new UnsupportedTypeException("parameter type " + type + " is not ordinal");
        };
    }

    /**
     * Returns an independent String for a textual value. A String is already immutable;
     * any other CharSequence (StringBuilder, CharBuffer, ...) is copied so later changes
     * by the caller cannot reach the buffer.
     */
    public static String toText(Object value) {
        if (value instanceof String s) return s;
        if (value instanceof CharSequence cs) return new StringBuilder(cs).toString();
        throw mismatch(value, DataType.VARCHAR);
    }

    private static long integral(Object value, DataType type) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw mismatch(value, type);
    }

    private static long checkedRange(long v, long min, long max, DataType type) {
        if (v < min || v > max) {
            throw new UnsupportedTypeException("value " + v + " out of range for " + type);
        }
        return v;
    }

    private static long epochMicros(Instant instant) {
        try {
            return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), MICROS_PER_SECOND),
                instant.getNano() / NANOS_PER_MICRO);
        } catch (ArithmeticException e) {
            throw new UnsupportedTypeException("timestamp out of range: " + instant);
        }
    }

    private static Instant instantOf(long micros) {
        return Instant.ofEpochSecond(Math.floorDiv(micros, MICROS_PER_SECOND),
            Math.floorMod(micros, MICROS_PER_SECOND) * NANOS_PER_MICRO);
    }

    private static UnsupportedTypeException mismatch(Object value, DataType type) {
        return new UnsupportedTypeException("value of class " + value.getClass().getName()
            + " cannot be used as " + type);
    }
}
