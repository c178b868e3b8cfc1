package org.pgbulk.manager;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.pgbulk.config.ColumnSpec;
import org.pgbulk.config.JobConfig;
import org.pgbulk.manager.util.StagingColumn;
import org.pgbulk.pipeline.CopySink;
import org.postgresql.copy.CopyIn;
import org.postgresql.copy.CopyManager;
import org.postgresql.core.BaseConnection;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * PostgreSQL statements issued by a load: staging table DDL, the {@code COPY ... FROM STDIN}
 * channel, statistics refresh and the final merge into the destination tables.
 * <p>
 * Every statement goes through the one transactional connection of the load. Statements are
 * serialized on that connection, so callers on several threads never interleave on the wire.
 */
public class PostgresqlManager {

    private static final Logger LOG = LogManager.getLogger(PostgresqlManager.class.getName());

    private final Connection connection;
    private final JobConfig config;
    private final Level progressLevel;

    public PostgresqlManager(Connection connection, JobConfig config) {
        this.connection = connection;
        this.config = config;
        this.progressLevel = config.isQuiet() ? Level.DEBUG : Level.INFO;
    }

    public Connection getConnection() {
        return connection;
    }

    /**
     * @return {@code DEBUG} for quiet jobs, {@code INFO} otherwise
     */
    public Level getProgressLevel() {
        return progressLevel;
    }

    /**
     * Opens the load transaction and, when a schema is configured, scopes name resolution
     * to it for the rest of the transaction.
     */
    public void beginTransaction() throws SQLException {
        synchronized (connection) {
            connection.setAutoCommit(false);
        }
        if (config.getSchema() != null && !config.getSchema().isEmpty()) {
            execute("SET LOCAL search_path TO " + escapeIdentifier(config.getSchema()));
        }
    }

    public void commit() throws SQLException {
        synchronized (connection) {
            LOG.debug("Committing transaction");
            connection.commit();
        }
    }

    /**
     * Rolls the load transaction back. A failure here is attached to the original error
     * instead of replacing it.
     */
    public void rollback(Exception cause) {
        synchronized (connection) {
            try {
                LOG.warn("Rolling back transaction: {}", cause.toString());
                connection.rollback();
            } catch (SQLException e) {
                LOG.error("Rollback failed", e);
                cause.addSuppressed(e);
            }
        }
    }

    /**
     * Executes one SQL command, or several separated by semicolons, without a result set.
     */
    public void execute(String sql) throws SQLException {
        synchronized (connection) {
            LOG.log(progressLevel, "{}: Executing SQL statement: {}", Thread.currentThread().getName(), sql);
            try (Statement statement = connection.createStatement()) {
                statement.execute(sql);
            }
        }
    }

    /**
     * Sends all commands in a single round trip.
     */
    public void executeBatch(List<String> statements) throws SQLException {
        if (statements.isEmpty()) return;
        execute(String.join("; ", statements));
    }

    public void createStagingTable(List<StagingColumn> columns) throws SQLException {
        String sql = getCreateStagingTableSql(config.getStagingTableName(), columns);
        LOG.log(progressLevel, "Creating staging table with this command: {}", sql);
        execute(sql);
    }

    /**
     * Starts {@code COPY ... FROM STDIN (FORMAT CSV)} on the target and wraps it in a sink
     * fed by the file pipelines. No other statement may run until the sink is finished.
     */
    public CopySink openCopySink(String tableName, List<String> columns) throws SQLException {
        String copyCmd = getCopyCommand(tableName, columns);
        LOG.log(progressLevel, "Copying data with this command: {}", copyCmd);

        CopyIn copyIn;
        synchronized (connection) {
            CopyManager copyManager = new CopyManager(connection.unwrap(BaseConnection.class));
            copyIn = copyManager.copyIn(copyCmd);
        }
        return new CopySink(copyIn, config.getCopyBufferRows());
    }

    public void analyze(String tableName) throws SQLException {
        execute("ANALYZE " + escapeIdentifier(tableName));
    }

    /**
     * Moves staged rows into every destination table, skipping rows whose key already exists.
     */
    public void mergeStagingTable(Map<String, List<ColumnSpec>> tables) throws SQLException {
        List<String> statements = getMergeStatements(config.getStagingTableName(), tables);
        LOG.log(progressLevel, "Merging staging table into {} tables", statements.size());
        execute(String.join(" ", statements));
    }

    String getCreateStagingTableSql(String stagingTable, List<StagingColumn> columns) {
        String columnsDDL = columns.stream()
                .map(c -> escapeIdentifier(c.getStagingName()) + " " + c.getSqlType())
                .collect(Collectors.joining(", "));

        return "CREATE TEMPORARY TABLE " + escapeIdentifier(stagingTable) + " (" + columnsDDL + ") ON COMMIT DROP";
    }

    String getCopyCommand(String tableName, List<String> columns) {
        StringBuilder copyCmd = new StringBuilder();

        copyCmd.append("COPY ");
        copyCmd.append(escapeIdentifier(tableName));
        copyCmd.append(" (");
        copyCmd.append(columns.stream().map(PostgresqlManager::escapeIdentifier).collect(Collectors.joining(", ")));
        copyCmd.append(")");
        copyCmd.append(" FROM STDIN (FORMAT CSV)");

        return copyCmd.toString();
    }

    List<String> getMergeStatements(String stagingTable, Map<String, List<ColumnSpec>> tables) {
        List<String> statements = new ArrayList<>();

        for (Map.Entry<String, List<ColumnSpec>> table : tables.entrySet()) {
            String tableName = table.getKey();
            List<String> targets = new ArrayList<>();
            List<String> projection = new ArrayList<>();

            for (ColumnSpec column : table.getValue()) {
                String staged = escapeIdentifier(tableName + "_" + column.getDestinationColumn());
                String value = column.isExpand() ? "unnest(" + staged + ")" : staged;
                if (column.hasCast()) value = value + "::" + column.getCastType();

                targets.add(escapeIdentifier(column.getDestinationColumn()));
                projection.add(value + " AS " + escapeIdentifier(column.getDestinationColumn()));
            }

            statements.add("INSERT INTO " + escapeIdentifier(tableName) +
                    " (" + String.join(", ", targets) + ")" +
                    " SELECT " + String.join(", ", projection) +
                    " FROM " + escapeIdentifier(stagingTable) +
                    " ON CONFLICT DO NOTHING;");
        }
        return statements;
    }

    /**
     * Double-quotes an identifier, doubling embedded quotes.
     */
    @NotNull
    public static String escapeIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
