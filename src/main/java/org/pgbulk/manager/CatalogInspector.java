package org.pgbulk.manager;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads index and constraint definitions of a table from the PostgreSQL system catalogs.
 * <p>
 * Queries run on the load's own connection so they see the transaction's view of the
 * schema. Tables are looked up in {@code current_schema()}.
 */
public class CatalogInspector {

    private static final Logger LOG = LogManager.getLogger(CatalogInspector.class.getName());

    // Indexes backing a primary key, unique or exclusion constraint go through the constraint path.
    static final String INDEXES_SQL =
            "SELECT i.indexname AS name, i.indexdef AS definition " +
            "FROM pg_indexes i " +
            "WHERE i.schemaname = current_schema() " +
            "AND i.tablename = ? " +
            "AND (? OR i.indexdef NOT ILIKE 'CREATE UNIQUE INDEX%') " +
            "AND NOT EXISTS ( " +
            "  SELECT 1 FROM pg_constraint con " +
            "  JOIN pg_class ic ON ic.oid = con.conindid " +
            "  JOIN pg_namespace ins ON ins.oid = ic.relnamespace " +
            "  WHERE con.contype IN ('p', 'u', 'x') " +
            "  AND ic.relname = i.indexname " +
            "  AND ins.nspname = i.schemaname) " +
            "ORDER BY i.indexname";

    // Primary keys are never dropped; not-null constraints (PostgreSQL 18+) are column attributes.
    static final String CONSTRAINTS_SQL =
            "SELECT con.conname AS name, pg_get_constraintdef(con.oid, true) AS definition " +
            "FROM pg_constraint con " +
            "JOIN pg_class cl ON con.conrelid = cl.oid " +
            "JOIN pg_namespace ns ON cl.relnamespace = ns.oid " +
            "WHERE ns.nspname = current_schema() " +
            "AND cl.relname = ? " +
            "AND con.contype NOT IN ('p', 'n') " +
            "ORDER BY con.contype = 'f' DESC, con.conname";

    private final Connection connection;
    private final boolean includeUniqueIndexes;

    public CatalogInspector(Connection connection, boolean includeUniqueIndexes) {
        this.connection = connection;
        this.includeUniqueIndexes = includeUniqueIndexes;
    }

    public List<SchemaObject> listIndexes(String tableName) throws SQLException {
        synchronized (connection) {
            try (PreparedStatement statement = connection.prepareStatement(INDEXES_SQL)) {
                statement.setString(1, tableName);
                statement.setBoolean(2, includeUniqueIndexes);
                List<SchemaObject> indexes = read(statement, tableName);
                LOG.debug("Found {} indexes on table {}", indexes.size(), tableName);
                return indexes;
            }
        }
    }

    public List<SchemaObject> listConstraints(String tableName) throws SQLException {
        synchronized (connection) {
            try (PreparedStatement statement = connection.prepareStatement(CONSTRAINTS_SQL)) {
                statement.setString(1, tableName);
                List<SchemaObject> constraints = read(statement, tableName);
                LOG.debug("Found {} constraints on table {}", constraints.size(), tableName);
                return constraints;
            }
        }
    }

    private List<SchemaObject> read(PreparedStatement statement, String tableName) throws SQLException {
        List<SchemaObject> objects = new ArrayList<>();
        try (ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                objects.add(new SchemaObject(rs.getString("name"), rs.getString("definition"), tableName));
            }
        }
        return objects;
    }
}
