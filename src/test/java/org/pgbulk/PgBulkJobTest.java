package org.pgbulk;

import org.apache.logging.log4j.LogManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pgbulk.config.ColumnSpec;
import org.pgbulk.config.ConfigurationException;
import org.pgbulk.config.JobConfig;
import org.pgbulk.pipeline.FinishHook;
import org.pgbulk.pipeline.RowParser;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PgBulkJobTest {

    private static JobConfig addressesOnly() {
        return JobConfig.builder().build()
                .addTable("addresses", List.of(
                        ColumnSpec.builder().destinationColumn("id").sourceColumn("address_id").sqlType("TEXT").build(),
                        ColumnSpec.of("street", "TEXT")));
    }

    private static JobConfig addressesAndUsers() {
        return addressesOnly().addTable("users", List.of(
                ColumnSpec.of("id", "TEXT"),
                ColumnSpec.builder().destinationColumn("address").sqlType("TEXT").referencesColumn("address_id").build()));
    }

    private static PgBulkJob job(JobConfig config, DataSource dataSource) {
        return new PgBulkJob(config, dataSource, RowParser.IDENTITY, FinishHook.NONE, LogManager.getLogger(PgBulkJobTest.class));
    }

    @Test
    void testStartWithoutFilesNeverTouchesTheDatabase() {
        DataSource dataSource = mock(DataSource.class);
        PgBulkJob job = job(addressesOnly(), dataSource);

        ConfigurationException e = assertThrows(ConfigurationException.class, job::start);

        assertEquals("No files registered.", e.getMessage());
        verifyNoInteractions(dataSource);
    }

    @Test
    void testStagingStrategyIsFixedAtConstruction() {
        assertFalse(job(addressesOnly(), mock(DataSource.class)).isUsingStaging());
        assertTrue(job(addressesAndUsers(), mock(DataSource.class)).isUsingStaging());
    }

    @Test
    void testTablesAreFixedAtConstruction() {
        JobConfig config = addressesOnly();
        PgBulkJob job = job(config, mock(DataSource.class));

        config.addTable("users", List.of(ColumnSpec.of("id", "TEXT")));

        assertFalse(job.isUsingStaging());
        assertEquals(List.of("addresses"), List.copyOf(job.getConfig().getTables().keySet()));
        assertThrows(UnsupportedOperationException.class,
                () -> job.getConfig().getTables().get("addresses").add(ColumnSpec.of("state", "TEXT")));
    }

    @Test
    void testInvalidConfigurationFailsAtConstruction() {
        JobConfig config = JobConfig.builder().build();

        assertThrows(ConfigurationException.class, () -> new PgBulkJob(config));
    }

    @Test
    void testRegisterAppendsSortedFiles(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("b.csv"), "address_id,street\n");
        Files.writeString(tempDir.resolve("a.csv"), "address_id,street\n");
        Files.createDirectories(tempDir.resolve("more"));
        Files.writeString(tempDir.resolve("more").resolve("c.csv"), "address_id,street\n");
        PgBulkJob job = job(addressesOnly(), mock(DataSource.class));

        assertEquals(2, job.register(tempDir, "*.csv"));
        assertEquals(1, job.register(tempDir.resolve("more"), "*.csv"));

        List<Path> files = job.getFiles();
        assertEquals(3, files.size());
        assertEquals("a.csv", files.get(0).getFileName().toString());
        assertThrows(UnsupportedOperationException.class, () -> files.add(tempDir));
    }

    @Test
    void testEndLeavesExternalDataSourceOpen() {
        DataSource dataSource = mock(DataSource.class);

        job(addressesOnly(), dataSource).end();

        verifyNoInteractions(dataSource);
    }
}
