package org.pgbulk.manager;

import java.util.List;

/**
 * Indexes or constraints recreated after a load do not match the ones that were dropped.
 * The enclosing transaction must not be committed.
 */
public class SchemaIntegrityException extends IllegalStateException {

    private final List<SchemaObject> missing;

    public SchemaIntegrityException(String message, List<SchemaObject> missing) {
        super(message);
        this.missing = List.copyOf(missing);
    }

    public List<SchemaObject> getMissing() {
        return missing;
    }
}
