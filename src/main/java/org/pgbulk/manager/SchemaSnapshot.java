package org.pgbulk.manager;

import java.util.Collections;
import java.util.List;

/**
 * Indexes and constraints removed for the duration of a load, in catalog order.
 */
public class SchemaSnapshot {

    public static final SchemaSnapshot EMPTY = new SchemaSnapshot(List.of(), List.of());

    private final List<SchemaObject> indexes;
    private final List<SchemaObject> constraints;

    public SchemaSnapshot(List<SchemaObject> indexes, List<SchemaObject> constraints) {
        this.indexes = Collections.unmodifiableList(indexes);
        this.constraints = Collections.unmodifiableList(constraints);
    }

    public List<SchemaObject> getIndexes() {
        return indexes;
    }

    public List<SchemaObject> getConstraints() {
        return constraints;
    }

    public boolean isEmpty() {
        return indexes.isEmpty() && constraints.isEmpty();
    }

    @Override
    public String toString() {
        return "SchemaSnapshot{indexes=" + indexes.size() + ", constraints=" + constraints.size() + '}';
    }
}
