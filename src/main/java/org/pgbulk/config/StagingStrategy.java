package org.pgbulk.config;

import java.util.List;

/**
 * Decides whether rows must travel through a temporary staging table.
 * <p>
 * A staging table is the only way to fan a row into more than one table inside
 * one transaction, and to unnest or cast values in the final {@code INSERT ... SELECT}.
 * A single table with plain columns is copied straight into its destination.
 */
public final class StagingStrategy {

    private StagingStrategy() {
    }

    public static boolean requiresStaging(JobConfig config) {
        if (config.isForceStaging()) return true;
        if (config.getTables().size() > 1) return true;

        for (List<ColumnSpec> columns : config.getTables().values()) {
            for (ColumnSpec column : columns) {
                if (column.isExpand() || column.hasCast()) return true;
            }
        }
        return false;
    }
}
