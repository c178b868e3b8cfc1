package org.pgbulk.cli;

import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;
import org.apache.commons.lang3.StringUtils;
import org.pgbulk.config.ColumnSpec;
import org.pgbulk.config.ConfigurationException;

/**
 * A job described in a Java properties file.
 * <p>
 * Besides the plain options, the file carries the table specification:
 * <pre>
 * tables=addresses,users
 * table.addresses.columns=id,street,state
 * table.addresses.id.type=TEXT
 * table.addresses.id.source=address_id
 * table.users.address.ref=address_id
 * table.users.tags.expand=true
 * table.users.tags.cast=text
 * </pre>
 * Column types default to {@code TEXT}.
 */
@Log4j2
public class OptionsFile {

    private static final String CONNECTION_PREFIX = "connect.parameter.";
    private static final String TABLE_PREFIX = "table.";
    static final String DEFAULT_SQL_TYPE = "TEXT";

    private final Properties properties;

    public OptionsFile(String optionsFilePath) throws IOException {
        this.properties = new Properties();
        loadProperties(optionsFilePath);
    }

    OptionsFile(Properties properties) {
        this.properties = properties;
        resolvePropertiesEnvVar();
    }

    public Properties getProperties() {
        return properties;
    }

    private void loadProperties(String optionsFilePath) throws IOException {
        try (FileReader in = new FileReader(optionsFilePath)) {
            this.properties.load(in);
            resolvePropertiesEnvVar();
        } catch (IOException e) {
            log.error(e);
            throw e;
        }
    }

    public Properties getConnectionParams() {
        Set<Object> propertyKeys = this.properties.keySet();
        Properties connectProps = new Properties();

        for (Object propertyKey : propertyKeys) {
            String key = (String) propertyKey;

            if (key.startsWith(CONNECTION_PREFIX)) {
                connectProps.setProperty(key.substring(CONNECTION_PREFIX.length()), this.properties.getProperty(key));
            }
        }
        return connectProps;
    }

    /**
     * Reads the table specification, keeping the order of the {@code tables} key and of each
     * {@code columns} key.
     *
     * @return table name to columns; empty when the file defines no tables
     */
    public Map<String, List<ColumnSpec>> getTables() {
        Map<String, List<ColumnSpec>> tables = new LinkedHashMap<>();

        for (String table : split(properties.getProperty("tables"))) {
            String prefix = TABLE_PREFIX + table + ".";
            List<String> columnNames = split(properties.getProperty(prefix + "columns"));
            if (columnNames.isEmpty())
                throw new ConfigurationException("Property " + prefix + "columns is missing or empty.");

            List<ColumnSpec> columns = new ArrayList<>();
            for (String column : columnNames) {
                String columnPrefix = prefix + column + ".";
                columns.add(ColumnSpec.builder()
                        .destinationColumn(column)
                        .sqlType(StringUtils.defaultIfBlank(properties.getProperty(columnPrefix + "type"), DEFAULT_SQL_TYPE))
                        .sourceColumn(StringUtils.trimToNull(properties.getProperty(columnPrefix + "source")))
                        .referencesColumn(StringUtils.trimToNull(properties.getProperty(columnPrefix + "ref")))
                        .expand(Boolean.parseBoolean(properties.getProperty(columnPrefix + "expand")))
                        .castType(StringUtils.trimToNull(properties.getProperty(columnPrefix + "cast")))
                        .build());
            }
            tables.put(table, columns);
        }

        log.debug("Tables defined in options file: {}", tables.keySet());
        return tables;
    }

    static List<String> split(String value) {
        if (StringUtils.isBlank(value)) return List.of();
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private void resolvePropertiesEnvVar() {
        Enumeration<?> propertyNames = this.properties.propertyNames();
        while (propertyNames.hasMoreElements()) {
            String name = propertyNames.nextElement().toString();
            String value = this.properties.getProperty(name);

            if (value != null && !value.isEmpty())
                this.properties.setProperty(name, EnvironmentVariableEvaluator.resolveEnvVars(value));
        }
    }
}
