package io.pgcom.jdbc;

import io.pgcom.CommandExecutor;
import io.pgcom.ConnectionSettings;
import io.pgcom.Connector;
import io.pgcom.CopyException;
import io.pgcom.Parameters;
import io.pgcom.QualifiedName;
import io.pgcom.QueryResult;
import io.pgcom.ScopedConnection;
import io.pgcom.Sql;
import io.pgcom.listen.Listener;
import io.pgcom.pool.PooledConnector;
import io.pgcom.spi.MetricsExporter;
import org.postgresql.PGConnection;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Higher-level PostgreSQL helpers for one database target: selects, bulk inserts and
 * {@code COPY} loads, catalog lookups and key-conflict filtering.
 *
 * <p>Table names may be schema qualified ({@code "model.people"}); unqualified names resolve to
 * the configured default schema, or {@code public}. In every write path {@code NaN} is stored
 * as SQL NULL.
 *
 * <pre>{@code
 * try (Commuter commuter = Commuter.create(settings)) {
 *     commuter.insertRow("people", Map.of("name", "Yeltsin", "age", 72));
 *     long count = ((Number) commuter.selectOne("SELECT COUNT(*) FROM people", 0)).longValue();
 * }
 * }</pre>
 *
 * <p>Closing the commuter closes its connector.
 */
public final class Commuter implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(Commuter.class.getName());

    private static final Set<String> INTEGER_TYPES = Set.of("smallint", "integer", "bigint");

    private final Connector connector;
    private final CommandExecutor executor;
    private final String schema;
    private final MetricsExporter metrics;

    /**
     * @param connector connection source; closed with this commuter
     * @param executor  executor over the same connector
     * @param schema    default schema for unqualified names, may be {@code null}
     * @param metrics   metrics exporter
     */
    public Commuter(Connector connector, CommandExecutor executor, String schema, MetricsExporter metrics) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.schema = schema;
    }

    /** Creates a commuter over a new HikariCP-backed connector. */
    public static Commuter create(ConnectionSettings settings) {
        return create(settings, MetricsExporter.NOOP);
    }

    public static Commuter create(ConnectionSettings settings, MetricsExporter metrics) {
        PooledConnector connector = PooledConnector.builder()
                .settings(settings)
                .poolFactory(HikariConnectionPool.factory())
                .metrics(metrics)
                .build();
        return new Commuter(connector, new CommandExecutor(connector, metrics), settings.schema(), metrics);
    }

    public Connector connector() {
        return connector;
    }

    public CommandExecutor executor() {
        return executor;
    }

    public QueryResult execute(String command) {
        return executor.execute(command);
    }

    public QueryResult execute(String command, Parameters parameters) {
        return executor.execute(command, parameters);
    }

    public QueryResult execute(String command, Parameters parameters, boolean commit) {
        return executor.execute(command, parameters, commit);
    }

    public QueryResult executeBatch(String command, List<Parameters> parameterSets) {
        return executor.executeBatch(command, parameterSets);
    }

    public void executeScript(Path script) {
        executeScript(script, true);
    }

    /**
     * Runs the whole file as one command in one transaction.
     */
    public void executeScript(Path script, boolean commit) {
        String text;
        try {
            text = Files.readString(script, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read script " + script, e);
        }
        executor.execute(text, Parameters.none(), commit);
    }

    /**
     * Runs a query with positional parameters.
     */
    public QueryResult select(String sql, Object... params) {
        return executor.execute(sql, Parameters.of(params));
    }

    /**
     * Returns the first column of the first row, or {@code defaultValue} when there is no row or
     * the value is NULL.
     */
    public Object selectOne(String sql, Object defaultValue) {
        Object value = executor.execute(sql).firstValue();
        return value != null ? value : defaultValue;
    }

    /**
     * Inserts every row of {@code data} in one batch.
     *
     * @param table table name, optionally schema qualified
     * @param data  rows to insert; column names must match table columns
     */
    public void insert(String table, QueryResult data) {
        if (data.isEmpty()) {
            return;
        }
        QualifiedName name = resolve(table);
        String sql = "INSERT INTO " + name.toSql() + " (" + Sql.identifiers(data.columns()) + ")" +
                " VALUES (" + Sql.placeholders(data.columns().size()) + ")";
        List<Parameters> batch = new ArrayList<>(data.size());
        for (List<Object> row : data.rows()) {
            batch.add(Parameters.of(Values.sqlValues(row)));
        }
        executor.executeBatch(sql, batch);
        logger.log(Level.FINE, "Inserted {0} rows into {1}", new Object[]{data.size(), name});
    }

    /**
     * Inserts one row.
     *
     * @param values column name to value, in insertion order
     */
    public void insertRow(String table, Map<String, ?> values) {
        executor.execute(insertRowSql(resolve(table), values), rowParameters(values));
    }

    /**
     * Inserts one row and returns the value of {@code returnId} from the inserted row.
     */
    public Object insertRow(String table, Map<String, ?> values, String returnId) {
        return insertReturn(insertRowSql(resolve(table), values), rowParameters(values), returnId);
    }

    /**
     * Runs an {@code INSERT} with {@code RETURNING <returnId>} appended and returns the value.
     */
    public Object insertReturn(String sql, Parameters params, String returnId) {
        Objects.requireNonNull(returnId, "returnId");
        return executor.execute(sql + " RETURNING " + Sql.identifier(returnId), params).firstValue();
    }

    public void copyFrom(String table, QueryResult data) {
        copyFrom(table, data, false);
    }

    /**
     * Bulk loads {@code data} with {@code COPY ... FROM STDIN (FORMAT csv)} in one transaction.
     *
     * @param formatData when {@code true}, columns are put in table order and integral floating
     *                   point values bound for integer columns are converted to whole numbers
     * @throws CopyException if the load fails; nothing is loaded
     */
    public void copyFrom(String table, QueryResult data, boolean formatData) {
        QualifiedName name = resolve(table);
        QueryResult rows = formatData ? formatForTable(table, data) : data;
        if (rows.isEmpty()) {
            return;
        }
        String copySql = "COPY " + name.toSql() + " (" + Sql.identifiers(rows.columns()) + ")" +
                " FROM STDIN (FORMAT csv)";
        try (ScopedConnection scoped = connector.openConnection()) {
            Connection conn = scoped.connection();
            long copied;
            try {
                conn.setAutoCommit(false);
                copied = conn.unwrap(PGConnection.class).getCopyAPI()
                        .copyIn(copySql, new StringReader(CsvRows.render(rows)));
                conn.commit();
            } catch (SQLException | IOException | RuntimeException e) {
                throw rollbackAndWrap(scoped, name, e);
            }
            conn.setAutoCommit(true);
            logger.log(Level.FINE, "Copied {0} rows into {1}", new Object[]{copied, name});
        } catch (SQLException e) {
            throw new CopyException("Copy failed on table: " + name + "\n" + e.getMessage(), e);
        }
    }

    private CopyException rollbackAndWrap(ScopedConnection scoped, QualifiedName table, Exception error) {
        metrics.incrementExecutionFailures();
        String message = "Copy failed on table: " + table + "\n" + error.getMessage();
        try {
            Connection conn = scoped.connection();
            conn.rollback();
            conn.setAutoCommit(true);
        } catch (SQLException | RuntimeException rollbackError) {
            metrics.incrementRollbackFailures();
            scoped.discardOnClose();
            CopyException ex = new CopyException(message + "\nunable to rollback: " + rollbackError.getMessage(), error);
            ex.addSuppressed(rollbackError);
            return ex;
        }
        return new CopyException(message, error);
    }

    private QueryResult formatForTable(String table, QueryResult data) {
        QueryResult tableColumns = getColumns(table);
        List<Object> names = tableColumns.column("column_name");
        List<Object> types = tableColumns.column("data_type");
        for (String column : data.columns()) {
            if (!names.contains(column)) {
                throw new IllegalArgumentException("Column " + column + " does not exist in table " + table);
            }
        }
        List<String> ordered = new ArrayList<>();
        List<Boolean> integral = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            String column = (String) names.get(i);
            if (data.columns().contains(column)) {
                ordered.add(column);
                integral.add(INTEGER_TYPES.contains((String) types.get(i)));
            }
        }
        List<List<Object>> rows = new ArrayList<>(data.size());
        for (List<Object> row : data.rows()) {
            List<Object> out = new ArrayList<>(ordered.size());
            for (int i = 0; i < ordered.size(); i++) {
                Object value = row.get(data.columnIndex(ordered.get(i)));
                if (integral.get(i) && value instanceof Double d && !d.isNaN() && d == Math.rint(d)) {
                    value = d.longValue();
                }
                out.add(value);
            }
            rows.add(out);
        }
        return new QueryResult(rows, ordered);
    }

    /** Whether {@code table} exists. */
    public boolean isTableExist(String table) {
        QualifiedName name = resolve(table);
        return !executor.execute(PostgresQueries.TABLE_EXISTS, Parameters.of(name.name(), name.schema())).isEmpty();
    }

    /**
     * Columns of {@code table} in ordinal order, as {@code (column_name, data_type)} rows.
     */
    public QueryResult getColumns(String table) {
        QualifiedName name = resolve(table);
        return executor.execute(PostgresQueries.COLUMNS, Parameters.of(name.schema(), name.name()));
    }

    /**
     * Primary key columns of {@code table}, as {@code (column_name, data_type)} rows.
     */
    public QueryResult primaryKey(String table) {
        return executor.execute(PostgresQueries.PRIMARY_KEY, Parameters.of(resolve(table).toSql()));
    }

    /**
     * Foreign key column pairs from {@code table} to {@code parent}, as
     * {@code (child_column, parent_column)} rows.
     */
    public QueryResult foreignKey(String table, String parent) {
        QualifiedName child = resolve(table);
        QualifiedName parentName = resolve(parent);
        return executor.execute(PostgresQueries.FOREIGN_KEY,
                Parameters.of(child.name(), child.schema(), parentName.name(), parentName.schema()));
    }

    /** Sum of backends connected to every database of the server. */
    public long getConnectionsCount() {
        return ((Number) selectOne(PostgresQueries.CONNECTIONS_COUNT, 0L)).longValue();
    }

    /**
     * Removes rows of {@code data} whose primary key is already present in {@code table}.
     *
     * <p>Only table rows with {@code filterColumn >= min(data.filterColumn)} are considered.
     *
     * @param primaryKey   primary key columns, present in both {@code data} and the table
     * @param filterColumn column bounding the lookup, present in both
     * @return the rows of {@code data} that do not conflict, in their original order
     */
    public QueryResult resolvePrimaryConflicts(String table, QueryResult data, List<String> primaryKey,
                                               String filterColumn) {
        if (data.isEmpty()) {
            return data;
        }
        QueryResult existing = selectFrom(table, filterColumn, Values.min(data.column(filterColumn)));
        if (existing.isEmpty()) {
            return data;
        }
        Set<List<Object>> taken = keys(existing, primaryKey);
        List<List<Object>> kept = new ArrayList<>();
        for (List<Object> row : data.rows()) {
            if (!taken.contains(key(data, row, primaryKey))) {
                kept.add(row);
            }
        }
        logger.log(Level.FINE, "Dropped {0} rows conflicting with primary key of {1}",
                new Object[]{data.size() - kept.size(), table});
        return data.withRows(kept);
    }

    /**
     * Keeps only rows of {@code data} whose foreign key exists in {@code parent}.
     *
     * <p>Only parent rows with {@code filterParent >= min(data.filterChild)} are considered. When
     * no parent row qualifies the result is empty.
     *
     * @param foreignKey foreign key columns, named the same in {@code data} and the parent
     */
    public QueryResult resolveForeignConflicts(String parent, QueryResult data, List<String> foreignKey,
                                               String filterParent, String filterChild) {
        if (data.isEmpty()) {
            return data;
        }
        QueryResult parents = selectFrom(parent, filterParent, Values.min(data.column(filterChild)));
        if (parents.isEmpty()) {
            return data.withRows(List.of());
        }
        Set<List<Object>> present = keys(parents, foreignKey);
        List<List<Object>> kept = new ArrayList<>();
        for (List<Object> row : data.rows()) {
            if (present.contains(key(data, row, foreignKey))) {
                kept.add(row);
            }
        }
        return data.withRows(kept);
    }

    /**
     * Creates a listener sharing this commuter's connector and executor. Each listener runs one
     * session.
     */
    public Listener listener() {
        return Listener.builder()
                .connector(connector)
                .executor(executor)
                .notificationSource(new PgNotificationSource())
                .schema(schema)
                .metrics(metrics)
                .build();
    }

    @Override
    public void close() {
        connector.closeAll();
    }

    private QueryResult selectFrom(String table, String filterColumn, Object minValue) {
        String sql = "SELECT * FROM " + resolve(table).toSql() + " WHERE " + Sql.identifier(filterColumn) + " >= ?";
        return executor.execute(sql, Parameters.of(minValue));
    }

    private static Set<List<Object>> keys(QueryResult result, List<String> keyColumns) {
        Set<List<Object>> keys = new HashSet<>();
        for (List<Object> row : result.rows()) {
            keys.add(key(result, row, keyColumns));
        }
        return keys;
    }

    private static List<Object> key(QueryResult result, List<Object> row, List<String> keyColumns) {
        List<Object> key = new ArrayList<>(keyColumns.size());
        for (String column : keyColumns) {
            key.add(Values.keyValue(row.get(result.columnIndex(column))));
        }
        return key;
    }

    private QualifiedName resolve(String table) {
        return QualifiedName.resolve(table, schema);
    }

    private static String insertRowSql(QualifiedName table, Map<String, ?> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("values must not be empty");
        }
        return "INSERT INTO " + table.toSql() + " (" + Sql.identifiers(new ArrayList<>(values.keySet())) + ")" +
                " VALUES (" + Sql.placeholders(values.size()) + ")";
    }

    private static Parameters rowParameters(Map<String, ?> values) {
        List<Object> row = new ArrayList<>(values.values());
        return Parameters.of(Values.sqlValues(row));
    }
}
