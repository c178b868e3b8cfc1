package org.pgbulk.utils;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Writes fully quoted CSV files of random users with their address, without a header line.
 */
public final class CsvTestData {

    public static final String[] HEADERS = {"id", "age", "name", "nickname", "address_id", "street", "state"};

    private static final String[] NAMES = {"Ada Lovelace", "Grace Hopper", "Alan Turing", "Edsger Dijkstra", "Barbara Liskov"};
    private static final String[] STATES = {"California", "New York", "Texas", "Oregon", "Ohio"};

    private CsvTestData() {
    }

    public static Path writeUsers(Path file, int rows) throws IOException {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        CSVFormat format = CSVFormat.DEFAULT.builder().setQuoteMode(QuoteMode.ALL).build();

        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (int i = 0; i < rows; i++) {
                String name = NAMES[random.nextInt(NAMES.length)];
                printer.printRecord(
                        UUID.randomUUID().toString(),
                        random.nextInt(1, 101),
                        name,
                        name.toLowerCase().replace(' ', '_') + i,
                        UUID.randomUUID().toString(),
                        random.nextInt(1, 9999) + " Main St",
                        STATES[random.nextInt(STATES.length)]);
            }
        }
        return file;
    }
}
