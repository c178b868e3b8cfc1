package org.pgbulk.manager;

import lombok.Value;

/**
 * An index or constraint as read from the catalog: its name, the definition needed
 * to create it again and the table it belongs to.
 */
@Value
public class SchemaObject {

    String name;
    String definition;
    String tableName;

    public boolean isForeignKey() {
        return definition != null && definition.startsWith("FOREIGN KEY");
    }

    /**
     * Identity used when comparing a snapshot with a fresh catalog listing.
     */
    String signature() {
        return name + '\u0000' + definition;
    }
}
