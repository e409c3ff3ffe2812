package io.pgcom;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Quoting helpers for composing SQL text with identifiers and literals that cannot be bound as
 * parameters (table names, channel names, DDL bodies).
 */
public final class Sql {

    /**
     * Quotes an identifier: {@code my"table} becomes {@code "my""table"}.
     *
     * @throws IllegalArgumentException if the identifier is empty or contains a NUL character
     */
    public static String identifier(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("identifier must not be empty");
        }
        if (name.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("identifier must not contain NUL");
        }
        return '"' + name.replace("\"", "\"\"") + '"';
    }

    /** Quotes each identifier and joins them with {@code ", "}. */
    public static String identifiers(List<String> names) {
        return names.stream().map(Sql::identifier).collect(Collectors.joining(", "));
    }

    /**
     * Quotes a string literal: {@code it's} becomes {@code 'it''s'}.
     */
    public static String literal(String value) {
        Objects.requireNonNull(value, "value");
        if (value.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("literal must not contain NUL");
        }
        return '\'' + value.replace("'", "''") + '\'';
    }

    /** Returns {@code count} positional placeholders joined with {@code ", "}. */
    public static String placeholders(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private Sql() {}
}
