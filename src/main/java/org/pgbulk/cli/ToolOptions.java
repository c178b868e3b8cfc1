package org.pgbulk.cli;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import lombok.Data;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.pgbulk.config.ColumnSpec;
import org.pgbulk.config.JobConfig;

@Data
@Log4j2
public class ToolOptions {

    private static final String DEFAULT_SOURCE_PATTERN = "*";

    private String connect;
    private String user;
    private String password;
    private Properties connectionParams = new Properties();
    private int poolSize = JobConfig.DEFAULT_POOL_SIZE;

    private String sourceDir;
    private String sourcePattern = DEFAULT_SOURCE_PATTERN;

    private String jobName = JobConfig.DEFAULT_JOB_NAME;
    private String stagingTable;
    private String schema;
    private boolean forceStaging = false;
    private boolean dropIndexes = false;
    private boolean dropForeignKeys = false;
    private boolean dropUniqueIndexes = false;

    private String csvHeaders;
    private char csvDelimiter = ',';
    private String csvCharset;
    private boolean csvSkipHeader = false;

    private int jobs = JobConfig.DEFAULT_JOBS;
    private int copyBufferRows = JobConfig.DEFAULT_COPY_BUFFER_ROWS;
    private boolean help = false;
    private boolean versionCheck = false;
    private boolean verbose = false;
    private boolean quiet = false;
    private String optionsFile;

    private Map<String, List<ColumnSpec>> tables = new LinkedHashMap<>();

    private Options options;

    public ToolOptions(String[] args) throws ParseException, IOException {
        checkOptions(args);
    }

    private void checkOptions(String[] args) throws ParseException, IOException {

        this.options = new Options();

        options.addOption(
                Option.builder()
                        .longOpt("connect")
                        .desc("PostgreSQL JDBC connect string")
                        .hasArg()
                        .argName("jdbc-uri")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("user")
                        .desc("Database authentication username")
                        .hasArg()
                        .argName("username")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("password")
                        .desc("Database authentication password")
                        .hasArg()
                        .argName("password")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("source-dir")
                        .desc("Directory scanned for input files")
                        .hasArg()
                        .argName("path")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("source-pattern")
                        .desc("Wildcard pattern of the input files relative to the source directory. Default *")
                        .hasArg()
                        .argName("pattern")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("staging-table")
                        .desc("Name of the temporary staging table. Default staging_<job-name>")
                        .hasArg()
                        .argName("table-name")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("schema")
                        .desc("Schema of the destination tables")
                        .hasArg()
                        .argName("schema-name")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("force-staging")
                        .desc("Load through a staging table even for a single plain table")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("drop-indexes")
                        .desc("Drop the indexes of the destination tables during the merge and recreate them afterwards")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("drop-foreign-keys")
                        .desc("Drop the constraints of the destination tables during the merge and recreate them afterwards")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("drop-unique-indexes")
                        .desc("Also drop unique indexes that do not back a constraint")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("csv-headers")
                        .desc("Field names of the input files. Default: read from the first line")
                        .hasArg()
                        .argName("col,col,col...")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("csv-delimiter")
                        .desc("Field delimiter of the input files. Default ,")
                        .hasArg()
                        .argName("char")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("options-file")
                        .desc("Options file path location")
                        .hasArg()
                        .argName("file-path")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("quiet")
                        .desc("Log job progress at debug level")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("version")
                        .desc("Show implementation version and exit")
                        .build()
        );

        Option helpOpt = new Option("h", "help", false, "Print this help screen");
        options.addOption(helpOpt);

        Option jobsOpt = new Option("j", "jobs", true, "Use n jobs to load files in parallel. Default 4");
        jobsOpt.setArgName("n");
        options.addOption(jobsOpt);

        Option verboseOpt = new Option("v", "verbose", false, "Print more information while working");
        options.addOption(verboseOpt);

        CommandLineParser parser = new DefaultParser();

        // If help argument is not passed is not necessary test the rest of arguments
        if (existsArgument(args, "-h", "--help")) {
            printHelp();
            this.setHelp(true);
        } else if (existsArgument(args, "--version")) {
            this.setVersionCheck(true);
        } else {
            CommandLine line = parser.parse(options, args);

            // options file first, the command line overrides it
            setOptionsFile(line.getOptionValue("options-file"));
            if (this.optionsFile != null && !this.optionsFile.isEmpty()) {
                loadOptionsFile();
            }

            if (line.hasOption("verbose")) this.verbose = true;
            if (line.hasOption("quiet")) this.quiet = true;
            if (line.hasOption("force-staging")) this.forceStaging = true;
            if (line.hasOption("drop-indexes")) this.dropIndexes = true;
            if (line.hasOption("drop-foreign-keys")) this.dropForeignKeys = true;
            if (line.hasOption("drop-unique-indexes")) this.dropUniqueIndexes = true;

            setConnectNotNull(line.getOptionValue("connect"));
            setUserNotNull(line.getOptionValue("user"));
            setPasswordNotNull(line.getOptionValue("password"));
            setSourceDirNotNull(line.getOptionValue("source-dir"));
            setSourcePatternNotNull(line.getOptionValue("source-pattern"));
            setStagingTableNotNull(line.getOptionValue("staging-table"));
            setSchemaNotNull(line.getOptionValue("schema"));
            setCsvHeadersNotNull(line.getOptionValue("csv-headers"));
            setCsvDelimiterNotNull(line.getOptionValue("csv-delimiter"));
            setJobsNotNull(line.getOptionValue("jobs"));

            if (!checkRequiredValues())
                throw new IllegalArgumentException("Missing any of the required parameters:" +
                        " connect=" + this.connect + " source-dir=" + this.sourceDir +
                        " tables=" + this.tables.keySet());
        }
    }

    private void printHelp() {
        String header = "\nArguments: \n";
        String footer = "\nTables are defined in the options file: tables=t1,t2 and table.<name>.columns=c1,c2";

        HelpFormatter formatter = new HelpFormatter();
        formatter.setWidth(140);
        formatter.printHelp("pgbulk [OPTIONS]", header, this.options, footer, false);
    }

    private static boolean existsArgument(String[] args, String... names) {
        for (String arg : args) {
            for (String name : names) {
                if (arg.equals(name)) return true;
            }
        }
        return false;
    }

    public String getVersion() {
        return ToolOptions.class.getPackage().getImplementationVersion();
    }

    public boolean checkRequiredValues() {
        if (this.connect == null) return false;
        if (this.sourceDir == null) return false;
        return !this.tables.isEmpty();
    }

    private void loadOptionsFile() throws IOException {

        OptionsFile of = new OptionsFile(this.optionsFile);
        Properties prop = of.getProperties();

        setConnectNotNull(prop.getProperty("connect"));
        setUserNotNull(prop.getProperty("user"));
        setPasswordNotNull(prop.getProperty("password"));
        setSourceDirNotNull(prop.getProperty("source.dir"));
        setSourcePatternNotNull(prop.getProperty("source.pattern"));
        setStagingTableNotNull(prop.getProperty("staging.table"));
        setSchemaNotNull(prop.getProperty("schema"));
        if (prop.getProperty("job.name") != null && !prop.getProperty("job.name").isEmpty())
            setJobName(prop.getProperty("job.name"));

        setForceStaging(Boolean.parseBoolean(prop.getProperty("force.staging")));
        setDropIndexes(Boolean.parseBoolean(prop.getProperty("drop.indexes")));
        setDropForeignKeys(Boolean.parseBoolean(prop.getProperty("drop.foreign.keys")));
        setDropUniqueIndexes(Boolean.parseBoolean(prop.getProperty("drop.unique.indexes")));
        setQuiet(Boolean.parseBoolean(prop.getProperty("quiet")));
        setVerbose(Boolean.parseBoolean(prop.getProperty("verbose")));

        setJobsNotNull(prop.getProperty("jobs"));
        setCopyBufferRows(prop.getProperty("copy.buffer.rows"));
        setPoolSize(prop.getProperty("pool.size"));

        setCsvHeadersNotNull(prop.getProperty("csv.headers"));
        setCsvDelimiterNotNull(prop.getProperty("csv.delimiter"));
        if (prop.getProperty("csv.charset") != null && !prop.getProperty("csv.charset").isEmpty())
            setCsvCharset(prop.getProperty("csv.charset"));
        setCsvSkipHeader(Boolean.parseBoolean(prop.getProperty("csv.skip.header")));

        setConnectionParams(of.getConnectionParams());
        setTables(of.getTables());
    }

    /**
     * Builds the job configuration from the parsed options.
     */
    public JobConfig toJobConfig() {
        JobConfig.JobConfigBuilder builder = JobConfig.builder()
                .tables(new LinkedHashMap<>(tables))
                .connect(connect)
                .user(user)
                .password(password)
                .connectionParams(connectionParams)
                .poolSize(poolSize)
                .jobName(jobName)
                .stagingTableName(stagingTable)
                .schema(schema)
                .forceStaging(forceStaging)
                .dropIndexes(dropIndexes)
                .dropForeignKeys(dropForeignKeys)
                .dropUniqueIndexes(dropUniqueIndexes)
                .quiet(quiet)
                .csvDelimiter(csvDelimiter)
                .csvSkipHeaderRecord(csvSkipHeader)
                .jobs(jobs)
                .copyBufferRows(copyBufferRows);

        List<String> headers = OptionsFile.split(csvHeaders);
        if (!headers.isEmpty()) builder.csvHeaders(headers);
        if (csvCharset != null) builder.csvCharset(Charset.forName(csvCharset));
        return builder.build();
    }

    /*
     * Getters & Setters
     */
    public void setConnectNotNull(String connect) {
        if (connect != null && !connect.isEmpty())
            this.connect = connect;
    }

    public void setUserNotNull(String user) {
        if (user != null && !user.isEmpty())
            this.user = user;
    }

    public void setPasswordNotNull(String password) {
        if (password != null && !password.isEmpty())
            this.password = password;
    }

    public void setSourceDirNotNull(String sourceDir) {
        if (sourceDir != null && !sourceDir.isEmpty())
            this.sourceDir = sourceDir;
    }

    public void setSourcePatternNotNull(String sourcePattern) {
        if (sourcePattern != null && !sourcePattern.isEmpty())
            this.sourcePattern = sourcePattern;
    }

    public void setStagingTableNotNull(String stagingTable) {
        if (stagingTable != null && !stagingTable.isEmpty())
            this.stagingTable = stagingTable;
    }

    public void setSchemaNotNull(String schema) {
        if (schema != null && !schema.isEmpty())
            this.schema = schema;
    }

    public void setCsvHeadersNotNull(String csvHeaders) {
        if (csvHeaders != null && !csvHeaders.isEmpty())
            this.csvHeaders = csvHeaders;
    }

    public void setCsvDelimiterNotNull(String csvDelimiter) {
        if (csvDelimiter == null || csvDelimiter.isEmpty()) return;
        if ("\\t".equals(csvDelimiter)) csvDelimiter = "\t";
        if (csvDelimiter.length() != 1) {
            log.error("Option --csv-delimiter must be a single character.");
            throw new IllegalArgumentException("Option --csv-delimiter must be a single character, found: " + csvDelimiter);
        }
        this.csvDelimiter = csvDelimiter.charAt(0);
    }

    public void setJobs(String jobs) {
        this.jobs = parsePositive(jobs, "jobs", this.jobs);
    }

    public void setJobsNotNull(String jobs) {
        if (jobs != null && !jobs.isEmpty())
            setJobs(jobs);
    }

    public void setCopyBufferRows(String copyBufferRows) {
        this.copyBufferRows = parsePositive(copyBufferRows, "copy-buffer-rows", this.copyBufferRows);
    }

    public void setPoolSize(String poolSize) {
        this.poolSize = parsePositive(poolSize, "pool-size", this.poolSize);
    }

    private int parsePositive(String value, String optionName, int current) {
        try {
            if (value != null && !value.isEmpty()) {
                int parsed = Integer.parseInt(value.trim());
                if (parsed <= 0) throw new NumberFormatException();
                return parsed;
            }
            return current;
        } catch (NumberFormatException e) {
            log.error("Option --{} must be a positive integer greater than 0.", optionName);
            throw e;
        }
    }
}
