package org.pgbulk.config;

import lombok.Builder;
import lombok.Data;
import org.pgbulk.manager.util.StagingColumn;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Everything a {@link org.pgbulk.PgBulkJob} needs to know before it starts: the target
 * tables and their columns, how to reach the database, and the load flags.
 */
@Data
@Builder(toBuilder = true)
public class JobConfig {

    public static final String DEFAULT_JOB_NAME = "pgbulk";
    public static final int DEFAULT_JOBS = 4;
    public static final int DEFAULT_COPY_BUFFER_ROWS = 10_000;
    public static final int DEFAULT_POOL_SIZE = 30;

    /** Table name to ordered column list, in merge order. */
    @Builder.Default
    private Map<String, List<ColumnSpec>> tables = new LinkedHashMap<>();

    private String connect;
    private String user;
    private String password;
    @Builder.Default
    private Properties connectionParams = new Properties();
    @Builder.Default
    private int poolSize = DEFAULT_POOL_SIZE;

    @Builder.Default
    private String jobName = DEFAULT_JOB_NAME;
    private String stagingTableName;
    private String schema;

    private boolean forceStaging;
    private boolean dropIndexes;
    private boolean dropForeignKeys;
    private boolean dropUniqueIndexes;
    private boolean quiet;

    // CSV reader
    private List<String> csvHeaders;
    @Builder.Default
    private char csvDelimiter = ',';
    @Builder.Default
    private Charset csvCharset = StandardCharsets.UTF_8;
    private boolean csvSkipHeaderRecord;

    @Builder.Default
    private int jobs = DEFAULT_JOBS;
    @Builder.Default
    private int copyBufferRows = DEFAULT_COPY_BUFFER_ROWS;

    public String getStagingTableName() {
        if (stagingTableName != null && !stagingTableName.isEmpty()) return stagingTableName;
        return "staging_" + (jobName == null || jobName.isEmpty() ? DEFAULT_JOB_NAME : jobName);
    }

    /**
     * Appends a table definition, keeping declaration order.
     */
    public JobConfig addTable(String tableName, List<ColumnSpec> columns) {
        if (!(this.tables instanceof LinkedHashMap)) {
            this.tables = new LinkedHashMap<>(this.tables);
        }
        this.tables.put(tableName, columns);
        return this;
    }

    /**
     * Checks the table specification and the numeric settings.
     *
     * @throws ConfigurationException on the first problem found
     */
    public void validate() {
        if (tables == null || tables.isEmpty())
            throw new ConfigurationException("At least one target table must be defined.");

        Set<String> sourceKeys = new HashSet<>();
        for (Map.Entry<String, List<ColumnSpec>> table : tables.entrySet()) {
            String tableName = table.getKey();
            if (tableName == null || tableName.isBlank())
                throw new ConfigurationException("Table names cannot be blank.");

            List<ColumnSpec> columns = table.getValue();
            if (columns == null || columns.isEmpty())
                throw new ConfigurationException("Table " + tableName + " has no columns.");

            Set<String> destinations = new HashSet<>();
            for (ColumnSpec column : columns) {
                if (column.getDestinationColumn() == null || column.getDestinationColumn().isBlank())
                    throw new ConfigurationException("Table " + tableName + " has a column without a name.");
                if (!destinations.add(column.getDestinationColumn()))
                    throw new ConfigurationException("Column " + column.getDestinationColumn()
                            + " is defined twice in table " + tableName + ".");
                if (column.getSqlType() == null || column.getSqlType().isBlank())
                    throw new ConfigurationException("Column " + tableName + "." + column.getDestinationColumn()
                            + " has no SQL type.");
                sourceKeys.add(column.getSourceKey());
            }
        }

        Set<String> stagingNames = new HashSet<>();
        for (StagingColumn column : StagingColumn.layout(tables)) {
            if (!stagingNames.add(column.getStagingName()))
                throw new ConfigurationException("Column " + column.getTableName() + "." + column.getDestinationColumn()
                        + " collides with another column on staging column name " + column.getStagingName() + ".");
        }

        for (Map.Entry<String, List<ColumnSpec>> table : tables.entrySet()) {
            for (ColumnSpec column : table.getValue()) {
                if (column.isReference() && !sourceKeys.contains(column.getReferencesColumn()))
                    throw new ConfigurationException("Column " + table.getKey() + "." + column.getDestinationColumn()
                            + " references unknown column " + column.getReferencesColumn() + ".");
            }
        }

        if (jobs <= 0) throw new ConfigurationException("Option jobs must be a positive integer greater than 0.");
        if (copyBufferRows <= 0)
            throw new ConfigurationException("Option copy buffer rows must be a positive integer greater than 0.");
        if (poolSize <= 0) throw new ConfigurationException("Option pool size must be a positive integer greater than 0.");
    }
}
