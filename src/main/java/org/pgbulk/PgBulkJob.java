package org.pgbulk;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pgbulk.config.ColumnSpec;
import org.pgbulk.config.ConfigurationException;
import org.pgbulk.config.JobConfig;
import org.pgbulk.config.StagingStrategy;
import org.pgbulk.manager.CatalogInspector;
import org.pgbulk.manager.ConnectionPool;
import org.pgbulk.manager.PostgresqlManager;
import org.pgbulk.manager.SchemaGuard;
import org.pgbulk.manager.file.FileDiscovery;
import org.pgbulk.manager.util.StagingColumn;
import org.pgbulk.pipeline.ColumnMapper;
import org.pgbulk.pipeline.CopySink;
import org.pgbulk.pipeline.FileLoadPipeline;
import org.pgbulk.pipeline.FinishHook;
import org.pgbulk.pipeline.RowParser;

import javax.sql.DataSource;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * A bulk load of delimited text files into one or more PostgreSQL tables.
 * <p>
 * Files are registered first, then {@link #start()} streams all of them through a single
 * {@code COPY} in one transaction. With more than one table, expanded or cast columns, or
 * when forced, rows go through a temporary staging table and are merged into every
 * destination table with {@code ON CONFLICT DO NOTHING}. Otherwise they are copied straight
 * into the only table. Either everything is committed or nothing is.
 */
public class PgBulkJob implements AutoCloseable {

    private static final Logger DEFAULT_LOG = LogManager.getLogger(PgBulkJob.class.getName());

    private final JobConfig config;
    private final Map<String, List<ColumnSpec>> tables;
    private final ConnectionPool pool;
    private final RowParser rowParser;
    private final FinishHook finishHook;
    private final Logger log;
    private final Level progressLevel;

    private final boolean usingStaging;
    private final ColumnMapper mapper;
    private final List<Path> files = new ArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public PgBulkJob(JobConfig config) {
        this(config, RowParser.IDENTITY, FinishHook.NONE);
    }

    public PgBulkJob(JobConfig config, RowParser rowParser, FinishHook finishHook) {
        this(config, null, rowParser, finishHook, DEFAULT_LOG);
    }

    /**
     * @param dataSource where connections come from; {@code null} to build a pool from the
     *                   connection settings of {@code config}
     * @param log        receives the progress messages of the job
     */
    public PgBulkJob(JobConfig config, DataSource dataSource, RowParser rowParser, FinishHook finishHook, Logger log) {
        config.validate();
        this.tables = snapshot(config.getTables());
        this.config = config.toBuilder().tables(tables).build();
        this.pool = dataSource == null ? new ConnectionPool(this.config) : new ConnectionPool(dataSource);
        this.rowParser = rowParser == null ? RowParser.IDENTITY : rowParser;
        this.finishHook = finishHook == null ? FinishHook.NONE : finishHook;
        this.log = log == null ? DEFAULT_LOG : log;
        this.progressLevel = this.config.isQuiet() ? Level.DEBUG : Level.INFO;

        this.usingStaging = StagingStrategy.requiresStaging(this.config);
        this.mapper = new ColumnMapper(tables);
    }

    // Tables are fixed once the job is built.
    private static Map<String, List<ColumnSpec>> snapshot(Map<String, List<ColumnSpec>> tables) {
        Map<String, List<ColumnSpec>> copy = new LinkedHashMap<>();
        tables.forEach((table, columns) -> copy.put(table, List.copyOf(columns)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Adds every file under {@code directory} matching {@code pattern} to the load.
     *
     * @return number of files added
     */
    public int register(Path directory, String pattern) {
        List<Path> found = FileDiscovery.find(directory, pattern);
        synchronized (files) {
            files.addAll(found);
        }
        log.log(progressLevel, "Registered {} files from {} matching '{}'", found.size(), directory, pattern);
        return found.size();
    }

    public List<Path> getFiles() {
        synchronized (files) {
            return Collections.unmodifiableList(new ArrayList<>(files));
        }
    }

    public boolean isUsingStaging() {
        return usingStaging;
    }

    /**
     * @return the job's own copy of the configuration it was built with
     */
    public JobConfig getConfig() {
        return config;
    }

    /**
     * Loads every registered file in one transaction.
     *
     * @return number of rows copied
     * @throws ConfigurationException when no file is registered
     * @throws IllegalStateException  when this job is already running
     */
    public long start() throws Exception {
        List<Path> toLoad = getFiles();
        if (toLoad.isEmpty()) throw new ConfigurationException("No files registered.");
        if (!running.compareAndSet(false, true))
            throw new IllegalStateException("Job " + config.getJobName() + " is already running");

        long startTime = System.currentTimeMillis();
        ExecutorService executor = Executors.newFixedThreadPool(config.getJobs(), workerThreadFactory());
        try (Connection connection = pool.getConnection()) {
            PostgresqlManager manager = new PostgresqlManager(connection, config);
            manager.beginTransaction();
            try {
                long rows = load(manager, toLoad, executor);
                manager.commit();
                log.log(progressLevel, "Job {} loaded {} rows from {} files in {} ms",
                        config.getJobName(), rows, toLoad.size(), System.currentTimeMillis() - startTime);
                return rows;
            } catch (Exception e) {
                log.error("Job {} failed: {}", config.getJobName(), e.getMessage());
                manager.rollback(e);
                throw e;
            }
        } finally {
            executor.shutdownNow();
            running.set(false);
        }
    }

    private long load(PostgresqlManager manager, List<Path> toLoad, ExecutorService executor) throws Exception {
        Connection connection = manager.getConnection();

        if (usingStaging) {
            log.log(progressLevel, "Using staging table {}", config.getStagingTableName());
            manager.createStagingTable(mapper.getColumns());
        }

        CatalogInspector inspector = new CatalogInspector(connection, config.isDropUniqueIndexes());
        SchemaGuard guard = new SchemaGuard(manager, inspector, tables.keySet(),
                config.isDropIndexes(), config.isDropForeignKeys(), executor, progressLevel);
        guard.capture();

        CopySink sink = usingStaging
                ? manager.openCopySink(config.getStagingTableName(), mapper.getColumns().stream()
                .map(StagingColumn::getStagingName).collect(Collectors.toList()))
                : manager.openCopySink(tables.keySet().iterator().next(), mapper.getColumns().stream()
                .map(StagingColumn::getDestinationColumn).collect(Collectors.toList()));

        long rows = copyFiles(toLoad, sink, executor);

        if (usingStaging) {
            manager.analyze(config.getStagingTableName());
        }

        guard.drop();
        if (usingStaging) {
            log.log(progressLevel, "Merging staging table into {}", tables.keySet());
            manager.mergeStagingTable(tables);
        }
        guard.recreate();
        guard.verify();

        for (String table : tables.keySet()) {
            manager.analyze(table);
        }

        finishHook.onFinish(connection);
        return rows;
    }

    private long copyFiles(List<Path> toLoad, CopySink sink, ExecutorService executor) throws Exception {
        CompletionService<Long> completion = new ExecutorCompletionService<>(executor);
        List<Future<Long>> futures = new ArrayList<>();
        for (Path file : toLoad) {
            futures.add(completion.submit(new FileLoadPipeline(file, config, rowParser, mapper, sink)));
        }

        long queued = 0;
        try {
            for (int done = 0; done < futures.size(); done++) {
                queued += completion.take().get();
            }
        } catch (ExecutionException | InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            sink.abort();
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw e;
            }
            throw unwrap((ExecutionException) e);
        }

        long copied;
        try {
            copied = sink.finish();
        } catch (Exception e) {
            sink.abort();
            throw e;
        }
        log.log(progressLevel, "Copied {} rows from {} files ({} rows read)", copied, toLoad.size(), queued);
        return copied;
    }

    private static Exception unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof UncheckedIOException) return ((UncheckedIOException) cause).getCause();
        if (cause instanceof Exception) return (Exception) cause;
        if (cause instanceof Error) throw (Error) cause;
        return e;
    }

    private ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> new Thread(r, config.getJobName() + "-worker-" + counter.incrementAndGet());
    }

    /**
     * Closes the connection pool of the job.
     */
    public void end() {
        log.log(progressLevel, "Closing job {}", config.getJobName());
        pool.close();
    }

    @Override
    public void close() {
        end();
    }
}
