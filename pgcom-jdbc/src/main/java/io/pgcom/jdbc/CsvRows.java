package io.pgcom.jdbc;

import io.pgcom.QueryResult;

import java.util.HexFormat;
import java.util.List;

/**
 * Renders rows as CSV for {@code COPY ... FROM STDIN (FORMAT csv)}.
 *
 * <p>SQL NULL and NaN become an unquoted empty field, which COPY reads as NULL. Strings are
 * always quoted so that an empty string stays an empty string. Byte arrays are written in the
 * {@code bytea} hex form {@code \x...}.
 */
final class CsvRows {

    static String render(QueryResult data) {
        StringBuilder sb = new StringBuilder();
        for (List<Object> row : data.rows()) {
            for (int i = 0; i < row.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                appendValue(sb, row.get(i));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void appendValue(StringBuilder sb, Object value) {
        Object v = Values.sqlValue(value);
        if (v == null) {
            return;
        }
        if (v instanceof Number || v instanceof Boolean) {
            sb.append(v);
            return;
        }
        if (v instanceof byte[] bytes) {
            sb.append("\\x").append(HexFormat.of().formatHex(bytes));
            return;
        }
        sb.append('"').append(v.toString().replace("\"", "\"\"")).append('"');
    }

    private CsvRows() {}
}
