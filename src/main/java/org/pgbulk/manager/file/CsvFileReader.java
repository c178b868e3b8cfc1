package org.pgbulk.manager.file;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pgbulk.config.JobConfig;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Streams the records of one delimited text file as header-keyed maps.
 * <p>
 * Headers come from the configured list, or from the first line of the file when none is
 * configured. Empty fields are read as {@code null}.
 */
public class CsvFileReader implements Iterable<Map<String, Object>>, Closeable {

    private static final Logger LOG = LogManager.getLogger(CsvFileReader.class.getName());

    private final Path file;
    private final CSVParser parser;

    public CsvFileReader(Path file, JobConfig config) throws IOException {
        this.file = file;
        this.parser = CSVParser.parse(file, config.getCsvCharset(), format(config));
        LOG.debug("Opened {} with headers {}", file, parser.getHeaderNames());
    }

    static CSVFormat format(JobConfig config) {
        CSVFormat.Builder builder = CSVFormat.DEFAULT.builder()
                .setDelimiter(config.getCsvDelimiter())
                .setNullString("")
                .setIgnoreEmptyLines(true);

        if (config.getCsvHeaders() != null && !config.getCsvHeaders().isEmpty()) {
            builder.setHeader(config.getCsvHeaders().toArray(new String[0]))
                    .setSkipHeaderRecord(config.isCsvSkipHeaderRecord());
        } else {
            builder.setHeader().setSkipHeaderRecord(true);
        }
        return builder.build();
    }

    public Path getFile() {
        return file;
    }

    @Override
    public Iterator<Map<String, Object>> iterator() {
        Iterator<CSVRecord> records = parser.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return records.hasNext();
            }

            @Override
            public Map<String, Object> next() {
                return new LinkedHashMap<>(records.next().toMap());
            }
        };
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
