package io.pgcom;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Values bound to one command: either positional (matched to {@code ?} placeholders in order)
 * or named (matched to {@code :name} placeholders).
 *
 * <p>Values may be {@code null}, which binds SQL NULL.
 */
public final class Parameters {
    private static final Parameters NONE = new Parameters(List.of(), null);

    private final List<Object> positional;
    private final Map<String, Object> named;

    private Parameters(List<Object> positional, Map<String, Object> named) {
        this.positional = positional;
        this.named = named;
    }

    /** No parameters; the command is sent as plain text. */
    public static Parameters none() {
        return NONE;
    }

    /** Positional parameters for {@code ?} placeholders. */
    public static Parameters of(Object... values) {
        Objects.requireNonNull(values, "values");
        if (values.length == 0) {
            return NONE;
        }
        return new Parameters(Collections.unmodifiableList(Arrays.asList(values.clone())), null);
    }

    /** Positional parameters for {@code ?} placeholders. */
    public static Parameters of(List<?> values) {
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            return NONE;
        }
        return new Parameters(Collections.unmodifiableList(new ArrayList<>(values)), null);
    }

    /** Named parameters for {@code :name} placeholders. */
    public static Parameters named(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "parameter name"), v));
        return new Parameters(List.of(), Collections.unmodifiableMap(copy));
    }

    public boolean isEmpty() {
        return named == null ? positional.isEmpty() : named.isEmpty();
    }

    public boolean isNamed() {
        return named != null;
    }

    /** Positional values; empty for named parameters. */
    public List<Object> values() {
        return positional;
    }

    /** Named values; empty for positional parameters. */
    public Map<String, Object> namedValues() {
        return named == null ? Map.of() : named;
    }

    /**
     * Binds the values to a prepared statement.
     *
     * @param names placeholder names in statement order, used when the parameters are named
     */
    void bind(PreparedStatement ps, List<String> names) throws SQLException {
        if (named == null) {
            for (int i = 0; i < positional.size(); i++) {
                bindValue(ps, i + 1, positional.get(i));
            }
            return;
        }
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            if (!named.containsKey(name)) {
                throw new IllegalArgumentException("No value supplied for parameter :" + name);
            }
            bindValue(ps, i + 1, named.get(name));
        }
    }

    private static void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
        if (value == null) {
            ps.setObject(index, null);
        } else if (value instanceof String s) {
            ps.setString(index, s);
        } else if (value instanceof Integer n) {
            ps.setInt(index, n);
        } else if (value instanceof Long n) {
            ps.setLong(index, n);
        } else if (value instanceof Timestamp ts) {
            ps.setTimestamp(index, ts);
        } else if (value instanceof Instant instant) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else if (value instanceof java.util.Date date) {
            ps.setTimestamp(index, new Timestamp(date.getTime()));
        } else {
            ps.setObject(index, value);
        }
    }

    @Override
    public String toString() {
        return named == null ? positional.toString() : named.toString();
    }
}
