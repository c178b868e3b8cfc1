package org.pgbulk.pipeline;

import org.pgbulk.config.ColumnSpec;
import org.pgbulk.config.ConfigurationException;
import org.pgbulk.manager.util.StagingColumn;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a flat source record into a staging row: one value per {@code (table, column)}
 * pair, in staging column order.
 * <p>
 * A source field lands in the first column whose source key matches it, scanning tables and
 * then columns in declaration order. Reference columns are then filled from the source field
 * their referenced column reads, taken from the original record. Both lookups are built once
 * here so mapping a row is a hash lookup per field.
 */
public class ColumnMapper {

    private final List<StagingColumn> columns;
    private final Map<String, Integer> directIndex = new HashMap<>();
    private final int[] referenceTargets;
    private final String[] referenceKeys;

    public ColumnMapper(Map<String, List<ColumnSpec>> tables) {
        this.columns = StagingColumn.layout(tables);

        for (int i = 0; i < columns.size(); i++) {
            directIndex.putIfAbsent(columns.get(i).getColumn().getSourceKey(), i);
        }

        List<Integer> targets = new ArrayList<>();
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            StagingColumn column = columns.get(i);
            if (!column.getColumn().isReference()) continue;

            String referenced = column.getColumn().getReferencesColumn();
            Integer source = directIndex.get(referenced);
            if (source == null)
                throw new ConfigurationException("Column " + column.getTableName() + "."
                        + column.getDestinationColumn() + " references unknown column " + referenced + ".");

            targets.add(i);
            keys.add(columns.get(source).getColumn().getSourceKey());
        }
        this.referenceTargets = targets.stream().mapToInt(Integer::intValue).toArray();
        this.referenceKeys = keys.toArray(new String[0]);
    }

    public List<StagingColumn> getColumns() {
        return columns;
    }

    public int getWidth() {
        return columns.size();
    }

    public Object[] map(Map<String, ?> record) {
        Object[] row = new Object[columns.size()];

        for (Map.Entry<String, ?> field : record.entrySet()) {
            Integer index = directIndex.get(field.getKey());
            if (index != null) row[index] = field.getValue();
        }

        for (int i = 0; i < referenceTargets.length; i++) {
            row[referenceTargets[i]] = record.get(referenceKeys[i]);
        }
        return row;
    }
}
