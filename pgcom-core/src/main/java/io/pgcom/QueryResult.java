package io.pgcom;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Rows and column names produced by one command.
 *
 * <p>Both lists are empty for commands without a result set (DDL, plain DML without
 * {@code RETURNING}). Row values may be {@code null} (SQL NULL). The same shape is used as
 * input for bulk writes.
 *
 * @param rows    result rows in server order, each with one value per column
 * @param columns column labels in select-list order
 */
public record QueryResult(List<List<Object>> rows, List<String> columns) {
    private static final QueryResult EMPTY = new QueryResult(List.of(), List.of());

    public QueryResult {
        Objects.requireNonNull(rows, "rows");
        columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            Objects.requireNonNull(row, "row");
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(
                        "Row has " + row.size() + " values but there are " + columns.size() + " columns");
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
    }

    /** Result of a command that produced no result set. */
    public static QueryResult empty() {
        return EMPTY;
    }

    /**
     * Creates a result from column names and rows of arbitrary element type.
     */
    public static QueryResult of(List<String> columns, List<? extends List<?>> rows) {
        List<List<Object>> converted = new ArrayList<>(rows.size());
        for (List<?> row : rows) {
            converted.add(new ArrayList<>(row));
        }
        return new QueryResult(converted, columns);
    }

    /**
     * Creates a result from column names and row arrays.
     */
    public static QueryResult ofRows(List<String> columns, Object[]... rows) {
        List<List<Object>> converted = new ArrayList<>(rows.length);
        for (Object[] row : rows) {
            converted.add(Arrays.asList(row));
        }
        return new QueryResult(converted, columns);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    /**
     * @return zero-based position of the column
     * @throws IllegalArgumentException if there is no such column
     */
    public int columnIndex(String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + column + ". Available: " + columns);
        }
        return index;
    }

    /**
     * @return all values of one column, in row order
     */
    public List<Object> column(String column) {
        int index = columnIndex(column);
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(index));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * @return the first column of the first row, or {@code null} if there are no rows
     */
    public Object firstValue() {
        if (rows.isEmpty() || columns.isEmpty()) {
            return null;
        }
        return rows.get(0).get(0);
    }

    /**
     * Returns a result with the same columns and only the given rows.
     */
    public QueryResult withRows(List<List<Object>> newRows) {
        return new QueryResult(newRows, columns);
    }
}
