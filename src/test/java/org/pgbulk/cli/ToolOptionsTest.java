package org.pgbulk.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pgbulk.config.JobConfig;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Option parsing from the command line and from the options file.
 */
class ToolOptionsTest {

    private static Path optionsFile(Path dir, String... lines) throws IOException {
        Path propsFile = dir.resolve("pgbulk.properties");
        try (FileWriter writer = new FileWriter(propsFile.toFile())) {
            for (String line : lines) writer.write(line + "\n");
        }
        return propsFile;
    }

    private static Path baseOptions(Path dir, String... extra) throws IOException {
        String[] lines = new String[3 + extra.length];
        lines[0] = "tables=addresses";
        lines[1] = "table.addresses.columns=id,street";
        lines[2] = "source.dir=" + dir.toString().replace("\\", "/");
        System.arraycopy(extra, 0, lines, 3, extra.length);
        return optionsFile(dir, lines);
    }

    @Test
    void testHelp() throws Exception {
        ToolOptions options = new ToolOptions(new String[]{"--help"});

        assertTrue(options.isHelp());
    }

    @Test
    void testVersion() throws Exception {
        ToolOptions options = new ToolOptions(new String[]{"--version"});

        assertTrue(options.isVersionCheck());
    }

    @Test
    void testMissingRequiredValues() {
        String[] args = {"--connect", "jdbc:postgresql://localhost:5432/app"};

        assertThrows(IllegalArgumentException.class, () -> new ToolOptions(args));
    }

    @Test
    void testDefaults(@TempDir Path tempDir) throws Exception {
        // Given: only the required values
        Path propsFile = baseOptions(tempDir);
        String[] args = {"--connect", "jdbc:postgresql://localhost:5432/app", "--options-file", propsFile.toString()};

        // When
        ToolOptions options = new ToolOptions(args);

        // Then
        assertEquals("*", options.getSourcePattern());
        assertEquals(4, options.getJobs());
        assertEquals(',', options.getCsvDelimiter());
        assertFalse(options.isForceStaging());
        assertFalse(options.isDropIndexes());
        assertFalse(options.isQuiet());
    }

    @Test
    void testCommandLineOverridesOptionsFile(@TempDir Path tempDir) throws Exception {
        // Given: jobs and schema in both places
        Path propsFile = baseOptions(tempDir,
                "connect=jdbc:postgresql://file:5432/app",
                "jobs=2",
                "schema=from_file");
        String[] args = {
                "--options-file", propsFile.toString(),
                "--connect", "jdbc:postgresql://cli:5432/app",
                "--jobs", "8",
                "--schema", "pgbulk"
        };

        // When
        ToolOptions options = new ToolOptions(args);

        // Then: the command line wins
        assertEquals("jdbc:postgresql://cli:5432/app", options.getConnect());
        assertEquals(8, options.getJobs());
        assertEquals("pgbulk", options.getSchema());
    }

    @Test
    void testFlags(@TempDir Path tempDir) throws Exception {
        Path propsFile = baseOptions(tempDir, "connect=jdbc:postgresql://localhost:5432/app");
        String[] args = {
                "--options-file", propsFile.toString(),
                "--force-staging", "--drop-indexes", "--drop-foreign-keys", "--drop-unique-indexes", "--quiet", "-v"
        };

        ToolOptions options = new ToolOptions(args);

        assertTrue(options.isForceStaging());
        assertTrue(options.isDropIndexes());
        assertTrue(options.isDropForeignKeys());
        assertTrue(options.isDropUniqueIndexes());
        assertTrue(options.isQuiet());
        assertTrue(options.isVerbose());
    }

    @Test
    void testInvalidJobs(@TempDir Path tempDir) throws Exception {
        Path propsFile = baseOptions(tempDir, "connect=jdbc:postgresql://localhost:5432/app");
        String[] args = {"--options-file", propsFile.toString(), "--jobs", "0"};

        assertThrows(NumberFormatException.class, () -> new ToolOptions(args));
    }

    @Test
    void testInvalidDelimiter(@TempDir Path tempDir) throws Exception {
        Path propsFile = baseOptions(tempDir, "connect=jdbc:postgresql://localhost:5432/app");
        String[] args = {"--options-file", propsFile.toString(), "--csv-delimiter", ";;"};

        assertThrows(IllegalArgumentException.class, () -> new ToolOptions(args));
    }

    @Test
    void testToJobConfig(@TempDir Path tempDir) throws Exception {
        Path propsFile = baseOptions(tempDir,
                "connect=jdbc:postgresql://localhost:5432/app",
                "user=loader",
                "job.name=nightly",
                "copy.buffer.rows=500",
                "csv.charset=ISO-8859-1",
                "connect.parameter.ApplicationName=pgbulk");
        String[] args = {
                "--options-file", propsFile.toString(),
                "--csv-headers", "id, street",
                "--csv-delimiter", "\\t"
        };

        JobConfig config = new ToolOptions(args).toJobConfig();

        assertEquals("jdbc:postgresql://localhost:5432/app", config.getConnect());
        assertEquals("loader", config.getUser());
        assertEquals("staging_nightly", config.getStagingTableName());
        assertEquals(500, config.getCopyBufferRows());
        assertEquals("ISO-8859-1", config.getCsvCharset().name());
        assertEquals('\t', config.getCsvDelimiter());
        assertEquals(java.util.List.of("id", "street"), config.getCsvHeaders());
        assertEquals("pgbulk", config.getConnectionParams().getProperty("ApplicationName"));
        assertEquals(2, config.getTables().get("addresses").size());
        assertDoesNotThrow(config::validate);
    }
}
