package org.pgbulk;

import lombok.extern.log4j.Log4j2;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.pgbulk.cli.ToolOptions;

import java.nio.file.Path;
import java.nio.file.Paths;

@Log4j2
public class PgBulk {

    private static final int SUCCESS = 0;
    private static final int ERROR = 1;

    public static void main(String[] args) {
        int exitCode;
        try {
            ToolOptions options = new ToolOptions(args);
            exitCode = processJob(options);
        } catch (ParseException | IllegalArgumentException e) {
            log.fatal("Errors parsing arguments: {}", e.getMessage());
            exitCode = ERROR;
        } catch (Exception e) {
            log.error(e);
            exitCode = ERROR;
        }
        System.exit(exitCode);
    }

    public static int processJob(ToolOptions options) {
        if (options.isHelp()) return SUCCESS;
        if (options.isVersionCheck()) {
            System.out.println("pgbulk " + options.getVersion());
            return SUCCESS;
        }
        if (options.isVerbose()) {
            Configurator.setRootLevel(Level.DEBUG);
        }

        long start = System.currentTimeMillis();
        PgBulkJob job = null;
        try {
            job = new PgBulkJob(options.toJobConfig());
            Path sourceDir = Paths.get(options.getSourceDir());
            job.register(sourceDir, options.getSourcePattern());

            long rows = job.start();
            log.info("Total process time: {}ms, {} rows loaded", System.currentTimeMillis() - start, rows);
            return SUCCESS;
        } catch (Exception e) {
            log.error("Got exception running pgbulk:", e);
            return ERROR;
        } finally {
            if (job != null) job.end();
        }
    }
}
