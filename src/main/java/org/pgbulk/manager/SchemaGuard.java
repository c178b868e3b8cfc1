package org.pgbulk.manager;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import static org.pgbulk.manager.PostgresqlManager.escapeIdentifier;

/**
 * Removes indexes and constraints of the destination tables while rows are merged,
 * then puts them back and proves they came back unchanged.
 * <p>
 * The guard moves through {@link State#CAPTURED}, {@link State#DROPPED},
 * {@link State#RECREATED} and {@link State#VERIFIED} in that order. Any failure leaves it
 * in {@link State#ERROR} and is rethrown so the load transaction rolls back.
 */
public class SchemaGuard {

    private static final Logger LOG = LogManager.getLogger(SchemaGuard.class.getName());

    public enum State {NEW, CAPTURED, DROPPED, RECREATED, VERIFIED, ERROR}

    private final PostgresqlManager manager;
    private final CatalogInspector inspector;
    private final List<String> tables;
    private final boolean dropIndexes;
    private final boolean dropConstraints;
    private final Executor executor;
    private final Level progressLevel;

    private State state = State.NEW;
    private SchemaSnapshot snapshot = SchemaSnapshot.EMPTY;

    public SchemaGuard(PostgresqlManager manager, CatalogInspector inspector, Collection<String> tables,
                       boolean dropIndexes, boolean dropConstraints, Executor executor) {
        this(manager, inspector, tables, dropIndexes, dropConstraints, executor, Level.INFO);
    }

    /**
     * @param progressLevel level of the capture and verification messages
     */
    public SchemaGuard(PostgresqlManager manager, CatalogInspector inspector, Collection<String> tables,
                       boolean dropIndexes, boolean dropConstraints, Executor executor, Level progressLevel) {
        this.manager = manager;
        this.inspector = inspector;
        this.tables = List.copyOf(tables);
        this.dropIndexes = dropIndexes;
        this.dropConstraints = dropConstraints;
        this.executor = executor;
        this.progressLevel = progressLevel;
    }

    public State getState() {
        return state;
    }

    public SchemaSnapshot getSnapshot() {
        return snapshot;
    }

    public Level getProgressLevel() {
        return progressLevel;
    }

    /**
     * Reads the definitions of every index and constraint that will be dropped.
     */
    public SchemaSnapshot capture() throws SQLException {
        expect(State.NEW);
        try {
            List<SchemaObject> indexes = dropIndexes ? listIndexes() : List.of();
            List<SchemaObject> constraints = dropConstraints ? listConstraints() : List.of();
            snapshot = new SchemaSnapshot(indexes, constraints);
            LOG.log(progressLevel, "Captured {} indexes and {} constraints on tables {}", indexes.size(), constraints.size(), tables);
        } catch (SQLException | RuntimeException e) {
            state = State.ERROR;
            throw e;
        }
        state = State.CAPTURED;
        return snapshot;
    }

    /**
     * Drops the captured constraints, foreign keys first, then the captured indexes.
     */
    public void drop() throws SQLException {
        expect(State.CAPTURED);
        try {
            List<String> statements = new ArrayList<>();
            for (SchemaObject constraint : foreignKeysFirst(snapshot.getConstraints())) {
                statements.add("ALTER TABLE " + escapeIdentifier(constraint.getTableName())
                        + " DROP CONSTRAINT " + escapeIdentifier(constraint.getName()));
            }
            manager.executeBatch(statements);

            if (!snapshot.getIndexes().isEmpty()) {
                String names = snapshot.getIndexes().stream()
                        .map(i -> escapeIdentifier(i.getName()))
                        .collect(Collectors.joining(", "));
                manager.execute("DROP INDEX IF EXISTS " + names + " RESTRICT");
            }
        } catch (SQLException | RuntimeException e) {
            state = State.ERROR;
            throw e;
        }
        state = State.DROPPED;
    }

    /**
     * Replays the captured index definitions, then adds the constraints back, foreign keys last.
     */
    public void recreate() throws SQLException {
        expect(State.DROPPED);
        try {
            manager.executeBatch(snapshot.getIndexes().stream()
                    .map(SchemaObject::getDefinition)
                    .collect(Collectors.toList()));

            List<SchemaObject> constraints = new ArrayList<>(foreignKeysFirst(snapshot.getConstraints()));
            Collections.reverse(constraints);
            List<String> statements = new ArrayList<>();
            for (SchemaObject constraint : constraints) {
                statements.add("ALTER TABLE " + escapeIdentifier(constraint.getTableName())
                        + " ADD CONSTRAINT " + escapeIdentifier(constraint.getName())
                        + " " + constraint.getDefinition());
            }
            manager.executeBatch(statements);
        } catch (SQLException | RuntimeException e) {
            state = State.ERROR;
            throw e;
        }
        state = State.RECREATED;
    }

    /**
     * Lists indexes and constraints again and checks every captured object is back with the
     * same definition. The index check and the constraint check run as two branches and both
     * have to finish.
     *
     * @throws SchemaIntegrityException when something captured is missing or changed
     */
    public void verify() throws SQLException {
        expect(State.RECREATED);
        CompletableFuture<Void> indexBranch = dropIndexes
                ? runBranch(() -> compare("Indexes", snapshot.getIndexes(), listIndexes()))
                : CompletableFuture.completedFuture(null);
        CompletableFuture<Void> constraintBranch = dropConstraints
                ? runBranch(() -> compare("Constraints", snapshot.getConstraints(), listConstraints()))
                : CompletableFuture.completedFuture(null);

        try {
            CompletableFuture.allOf(indexBranch, constraintBranch).join();
        } catch (CompletionException e) {
            state = State.ERROR;
            Throwable cause = e.getCause();
            if (cause instanceof SQLException) throw (SQLException) cause;
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw e;
        }
        state = State.VERIFIED;
        LOG.log(progressLevel, "Verified {} indexes and {} constraints", snapshot.getIndexes().size(), snapshot.getConstraints().size());
    }

    private CompletableFuture<Void> runBranch(SqlTask task) {
        return CompletableFuture.runAsync(() -> {
            try {
                task.run();
            } catch (SQLException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    private void compare(String kind, List<SchemaObject> expected, List<SchemaObject> found) {
        Set<String> present = new HashSet<>();
        for (SchemaObject object : found) present.add(object.signature());

        List<SchemaObject> missing = expected.stream()
                .filter(object -> !present.contains(object.signature()))
                .collect(Collectors.toList());

        if (!missing.isEmpty()) {
            LOG.error("{} do not match after recreation, missing or changed: {}", kind, missing);
            throw new SchemaIntegrityException(kind + " do not match. Rolled back", missing);
        }
    }

    private List<SchemaObject> listIndexes() throws SQLException {
        List<SchemaObject> indexes = new ArrayList<>();
        for (String table : tables) indexes.addAll(inspector.listIndexes(table));
        return indexes;
    }

    private List<SchemaObject> listConstraints() throws SQLException {
        List<SchemaObject> constraints = new ArrayList<>();
        for (String table : tables) constraints.addAll(inspector.listConstraints(table));
        return constraints;
    }

    private static List<SchemaObject> foreignKeysFirst(List<SchemaObject> constraints) {
        return constraints.stream()
                .sorted(Comparator.comparing((SchemaObject c) -> !c.isForeignKey()))
                .collect(Collectors.toList());
    }

    private void expect(State expected) {
        if (state != expected)
            throw new IllegalStateException("Schema guard is " + state + ", expected " + expected);
    }

    @FunctionalInterface
    private interface SqlTask {
        void run() throws SQLException;
    }
}
