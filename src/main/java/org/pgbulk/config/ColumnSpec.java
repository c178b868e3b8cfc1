package org.pgbulk.config;

import lombok.Builder;
import lombok.Value;

/**
 * One destination column of a target table and where its value comes from.
 * <p>
 * The source field defaults to the destination column name. A column with a
 * {@code referencesColumn} is filled from the source field the referenced column
 * reads, which lets a shared identifier land in several tables.
 */
@Value
@Builder(toBuilder = true)
public class ColumnSpec {

    String destinationColumn;
    String sourceColumn;
    String sqlType;
    String referencesColumn;
    boolean expand;
    String castType;

    /**
     * @return the key this column reads from a source record.
     */
    public String getSourceKey() {
        return sourceColumn != null ? sourceColumn : destinationColumn;
    }

    public boolean isReference() {
        return referencesColumn != null && !referencesColumn.isEmpty();
    }

    public boolean hasCast() {
        return castType != null && !castType.isEmpty();
    }

    public static ColumnSpec of(String destinationColumn, String sqlType) {
        return ColumnSpec.builder().destinationColumn(destinationColumn).sqlType(sqlType).build();
    }
}
