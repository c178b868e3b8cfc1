package org.pgbulk.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pgbulk.config.JobConfig;
import org.pgbulk.manager.file.CsvFileReader;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Loads one file: read, parse hook, column mapping, COPY encoding, then the shared sink.
 * Runs on a worker thread of the load and returns the number of rows it queued.
 */
public class FileLoadPipeline implements Callable<Long> {

    private static final Logger LOG = LogManager.getLogger(FileLoadPipeline.class.getName());

    private final Path file;
    private final JobConfig config;
    private final RowParser parser;
    private final ColumnMapper mapper;
    private final CopySink sink;

    public FileLoadPipeline(Path file, JobConfig config, RowParser parser, ColumnMapper mapper, CopySink sink) {
        this.file = file;
        this.config = config;
        this.parser = parser;
        this.mapper = mapper;
        this.sink = sink;
    }

    @Override
    public Long call() throws Exception {
        LOG.debug("{}: Loading file {}", Thread.currentThread().getName(), file);
        CopyRowFormatter formatter = new CopyRowFormatter(mapper.getWidth());
        long rows = 0;

        try (CsvFileReader reader = new CsvFileReader(file, config)) {
            for (Map<String, Object> record : reader) {
                if (Thread.currentThread().isInterrupted())
                    throw new InterruptedException("Load of " + file + " was cancelled");

                Map<String, Object> parsed = parser.parse(record);
                if (parsed == null)
                    throw new IllegalStateException("Row parser returned no record for row " + (rows + 1) + " of " + file);

                sink.write(formatter.format(mapper.map(parsed)));
                rows++;
            }
        }

        LOG.debug("{}: File {} done, {} rows", Thread.currentThread().getName(), file, rows);
        return rows;
    }

    public Path getFile() {
        return file;
    }
}
