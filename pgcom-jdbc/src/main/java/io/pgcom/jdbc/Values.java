package io.pgcom.jdbc;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Value normalization shared by the bulk write and conflict resolution helpers.
 */
final class Values {

    /** Maps NaN to {@code null}; other values are returned unchanged. */
    static Object sqlValue(Object value) {
        if (value instanceof Double d && d.isNaN()) {
            return null;
        }
        if (value instanceof Float f && f.isNaN()) {
            return null;
        }
        return value;
    }

    static List<Object> sqlValues(List<Object> row) {
        List<Object> out = new ArrayList<>(row.size());
        for (Object value : row) {
            out.add(sqlValue(value));
        }
        return out;
    }

    /**
     * Maps a value to a form whose {@code equals} ignores the JDBC type it was read as, so that
     * an {@code Integer} 5 from the caller matches a {@code Long} 5 from the database.
     */
    static Object keyValue(Object value) {
        Object v = sqlValue(value);
        if (v instanceof Number n) {
            if (isInfinite(n)) {
                return n.doubleValue();
            }
            return new BigDecimal(n.toString()).stripTrailingZeros();
        }
        if (v instanceof Timestamp ts) {
            return ts.toLocalDateTime();
        }
        if (v instanceof java.sql.Date d) {
            return d.toLocalDate();
        }
        return v;
    }

    /**
     * Orders two non-null values: numbers by magnitude, everything else by natural order.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compare(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            if (isInfinite(x) || isInfinite(y)) {
                return Double.compare(x.doubleValue(), y.doubleValue());
            }
            return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString()));
        }
        if (a instanceof Comparable c) {
            return c.compareTo(b);
        }
        throw new IllegalArgumentException("Values are not comparable: " + a.getClass().getName());
    }

    /**
     * Smallest non-null value of a column.
     *
     * @throws IllegalArgumentException if every value is null
     */
    static Object min(List<Object> values) {
        Object min = null;
        for (Object value : values) {
            Object v = sqlValue(value);
            if (v != null && (min == null || compare(v, min) < 0)) {
                min = v;
            }
        }
        if (min == null) {
            throw new IllegalArgumentException("Column has no non-null values");
        }
        return min;
    }

    private static boolean isInfinite(Number n) {
        return (n instanceof Double || n instanceof Float) && Double.isInfinite(n.doubleValue());
    }

    private Values() {}
}
