package org.pgbulk.manager.util;

import org.pgbulk.config.ColumnSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A column of the staging table: the destination table it feeds and the column spec
 * it was built from. Staging columns are named {@code <table>_<destinationColumn>}.
 */
public class StagingColumn {
    private final String tableName;
    private final ColumnSpec column;
    private final String stagingName;

    public StagingColumn(String tableName, ColumnSpec column) {
        this.tableName = tableName;
        this.column = column;
        this.stagingName = tableName + "_" + column.getDestinationColumn();
    }

    public String getTableName() {
        return tableName;
    }

    public ColumnSpec getColumn() {
        return column;
    }

    public String getStagingName() {
        return stagingName;
    }

    public String getDestinationColumn() {
        return column.getDestinationColumn();
    }

    public String getSqlType() {
        return column.getSqlType();
    }

    /**
     * Flattens the table specification into staging column order: tables in declaration
     * order, columns in declaration order within each table.
     */
    public static List<StagingColumn> layout(Map<String, List<ColumnSpec>> tables) {
        List<StagingColumn> columns = new ArrayList<>();
        for (Map.Entry<String, List<ColumnSpec>> table : tables.entrySet()) {
            for (ColumnSpec column : table.getValue()) {
                columns.add(new StagingColumn(table.getKey(), column));
            }
        }
        return Collections.unmodifiableList(columns);
    }

    @Override
    public String toString() {
        return "StagingColumn{" +
                "tableName='" + tableName + '\'' +
                ", stagingName='" + stagingName + '\'' +
                ", sqlType='" + column.getSqlType() + '\'' +
                '}';
    }
}
