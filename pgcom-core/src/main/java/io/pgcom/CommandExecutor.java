package io.pgcom;

import io.pgcom.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs commands on connections drawn from a {@link Connector}, one transaction per call.
 *
 * <p>Each call switches autocommit off, runs the statement (or the whole batch), reads the
 * result set if there is one, and then commits or rolls back depending on the {@code commit}
 * flag. On failure the transaction is rolled back and a {@link QueryExecutionException} is
 * thrown; if the rollback fails as well the connection is discarded instead of being returned
 * to the pool.
 *
 * <pre>{@code
 * CommandExecutor executor = new CommandExecutor(connector);
 * executor.execute("INSERT INTO people (name) VALUES (?)", Parameters.of("alice"));
 * QueryResult r = executor.execute("SELECT name FROM people WHERE id = :id",
 *     Parameters.named(Map.of("id", 1)));
 * }</pre>
 *
 * <p>This class is thread-safe; every call uses its own connection.
 */
public final class CommandExecutor {
    private static final Logger logger = Logger.getLogger(CommandExecutor.class.getName());

    private final Connector connector;
    private final MetricsExporter metrics;

    public CommandExecutor(Connector connector) {
        this(connector, MetricsExporter.NOOP);
    }

    public CommandExecutor(Connector connector, MetricsExporter metrics) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public QueryResult execute(String command) {
        return execute(command, Parameters.none(), true);
    }

    public QueryResult execute(String command, Parameters parameters) {
        return execute(command, parameters, true);
    }

    /**
     * Executes one command.
     *
     * @param command    SQL text; may contain {@code ?} or {@code :name} placeholders
     * @param parameters values for the placeholders
     * @param commit     {@code true} to commit, {@code false} to roll the work back after reading
     *                   the result
     * @return the rows and columns of the last result set, or {@link QueryResult#empty()}
     * @throws QueryExecutionException if the command fails
     */
    public QueryResult execute(String command, Parameters parameters, boolean commit) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(parameters, "parameters");
        return run(command, List.of(parameters), commit, false);
    }

    public QueryResult executeBatch(String command, List<Parameters> parameterSets) {
        return executeBatch(command, parameterSets, true);
    }

    /**
     * Executes one command once per parameter set in a single JDBC batch and transaction.
     *
     * @throws IllegalArgumentException if {@code parameterSets} is empty or mixes named and
     *                                  positional parameters
     * @throws QueryExecutionException  if the batch fails; no parameter set is applied
     */
    public QueryResult executeBatch(String command, List<Parameters> parameterSets, boolean commit) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(parameterSets, "parameterSets");
        if (parameterSets.isEmpty()) {
            throw new IllegalArgumentException("parameterSets must not be empty");
        }
        boolean named = parameterSets.get(0).isNamed();
        for (Parameters p : parameterSets) {
            if (Objects.requireNonNull(p, "parameters").isNamed() != named) {
                throw new IllegalArgumentException("Cannot mix named and positional parameters in one batch");
            }
        }
        return run(command, parameterSets, commit, true);
    }

    private QueryResult run(String command, List<Parameters> parameterSets, boolean commit, boolean batch) {
        long start = System.nanoTime();
        try (ScopedConnection scoped = connector.openConnection()) {
            Connection conn = scoped.connection();
            QueryResult result;
            try {
                conn.setAutoCommit(false);
                result = batch ? runBatch(conn, command, parameterSets) : runSingle(conn, command, parameterSets.get(0));
                if (commit) {
                    conn.commit();
                } else {
                    conn.rollback();
                }
            } catch (SQLException | RuntimeException e) {
                throw rollbackAndWrap(scoped, command, e);
            }
            restoreAutoCommit(scoped);
            return result;
        } catch (SQLException e) {
            metrics.incrementExecutionFailures();
            throw new QueryExecutionException(failureMessage(command, e), e);
        } finally {
            metrics.recordExecutionDurationMs((System.nanoTime() - start) / 1_000_000);
        }
    }

    private QueryExecutionException rollbackAndWrap(ScopedConnection scoped, String command, Exception error) {
        metrics.incrementExecutionFailures();
        try {
            scoped.connection().rollback();
        } catch (SQLException | RuntimeException rollbackError) {
            metrics.incrementRollbackFailures();
            scoped.discardOnClose();
            logger.log(Level.WARNING, "Rollback failed, discarding connection", rollbackError);
            QueryExecutionException ex = new QueryExecutionException(
                    failureMessage(command, error) + "\nunable to rollback: " + rollbackError.getMessage(), error);
            ex.addSuppressed(rollbackError);
            return ex;
        }
        restoreAutoCommit(scoped);
        logger.log(Level.FINE, "Command failed and was rolled back: {0}", command);
        return new QueryExecutionException(failureMessage(command, error), error);
    }

    static String failureMessage(String command, Exception error) {
        return "Execution failed on sql: " + command + "\n" + error.getMessage();
    }

    private static void restoreAutoCommit(ScopedConnection scoped) {
        try {
            scoped.connection().setAutoCommit(true);
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Failed to restore autocommit, discarding connection", e);
            scoped.discardOnClose();
        }
    }

    private static QueryResult runSingle(Connection conn, String command, Parameters parameters)
            throws SQLException {
        if (parameters.isEmpty() && !parameters.isNamed()) {
            try (Statement st = conn.createStatement()) {
                return drain(st, st.execute(command));
            }
        }
        NamedParameterSql parsed = parameters.isNamed() ? NamedParameterSql.parse(command) : null;
        String sql = parsed != null ? parsed.sql() : command;
        List<String> names = parsed != null ? parsed.names() : List.of();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            parameters.bind(ps, names);
            return drain(ps, ps.execute());
        }
    }

    private static QueryResult runBatch(Connection conn, String command, List<Parameters> parameterSets)
            throws SQLException {
        NamedParameterSql parsed = parameterSets.get(0).isNamed() ? NamedParameterSql.parse(command) : null;
        String sql = parsed != null ? parsed.sql() : command;
        List<String> names = parsed != null ? parsed.names() : List.of();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (Parameters parameters : parameterSets) {
                parameters.bind(ps, names);
                ps.addBatch();
            }
            int[] counts = ps.executeBatch();
            logger.log(Level.FINE, "Batch applied {0} parameter sets", counts.length);
            return QueryResult.empty();
        }
    }

    // keeps the last result set, so a script's final SELECT is what the caller sees
    private static QueryResult drain(Statement st, boolean isResultSet) throws SQLException {
        QueryResult last = QueryResult.empty();
        boolean hasResult = isResultSet;
        while (true) {
            if (hasResult) {
                try (ResultSet rs = st.getResultSet()) {
                    last = read(rs);
                }
            } else if (st.getUpdateCount() == -1) {
                return last;
            }
            hasResult = st.getMoreResults();
        }
    }

    static QueryResult read(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int count = md.getColumnCount();
        List<String> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            columns.add(md.getColumnLabel(i));
        }
        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Object[] row = new Object[count];
            for (int i = 1; i <= count; i++) {
                row[i - 1] = rs.getObject(i);
            }
            rows.add(Arrays.asList(row));
        }
        return new QueryResult(rows, columns);
    }
}
