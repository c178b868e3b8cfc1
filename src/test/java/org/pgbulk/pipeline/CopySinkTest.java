package org.pgbulk.pipeline;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class CopySinkTest {

    private static byte[] row(String text) {
        return (text + "\n").getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testRowsAreWrittenInOrder() throws Exception {
        RecordingCopyIn copyIn = new RecordingCopyIn();
        CopySink sink = new CopySink(copyIn, 4);

        for (int i = 0; i < 100; i++) {
            sink.write(row("\"" + i + "\""));
        }
        long copied = sink.finish();

        assertEquals(100, copied);
        assertEquals(100, sink.getRowsWritten());
        assertTrue(copyIn.isEndCopyCalled());
        String[] lines = copyIn.lines();
        for (int i = 0; i < 100; i++) {
            assertEquals("\"" + i + "\"", lines[i]);
        }
    }

    @Test
    void testFinishWithoutRows() throws Exception {
        RecordingCopyIn copyIn = new RecordingCopyIn();
        CopySink sink = new CopySink(copyIn, 2);

        assertEquals(0, sink.finish());
        assertTrue(copyIn.isEndCopyCalled());
    }

    @Test
    void testConcurrentProducersKeepEveryRow() throws Exception {
        RecordingCopyIn copyIn = new RecordingCopyIn();
        CopySink sink = new CopySink(copyIn, 8);
        ExecutorService producers = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int p = 0; p < 4; p++) {
                int producer = p;
                futures.add(producers.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        sink.write(row(producer + "-" + i));
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            producers.shutdownNow();
        }

        assertEquals(2000, sink.finish());
        // each producer's rows stay in their own order
        String[] lines = copyIn.lines();
        int[] next = new int[4];
        for (String line : lines) {
            String[] parts = line.split("-");
            int producer = Integer.parseInt(parts[0]);
            assertEquals(next[producer]++, Integer.parseInt(parts[1]));
        }
    }

    @Test
    void testWriterBlocksWhileQueueIsFull() throws Exception {
        RecordingCopyIn copyIn = new RecordingCopyIn(-1, true);
        CopySink sink = new CopySink(copyIn, 2);

        // one row held by the drainer, two in the queue, the fourth must wait
        CompletableFuture<Void> producer = CompletableFuture.runAsync(() -> {
            try {
                for (int i = 0; i < 4; i++) sink.write(row(String.valueOf(i)));
            } catch (IOException e) {
                throw new RuntimeException(e);
            }
        });

        assertThrows(TimeoutException.class, () -> producer.get(300, TimeUnit.MILLISECONDS));

        copyIn.release();
        producer.get(5, TimeUnit.SECONDS);
        assertEquals(4, sink.finish());
    }

    @Test
    void testCopyFailureReachesProducers() throws Exception {
        RecordingCopyIn copyIn = new RecordingCopyIn(3, false);
        CopySink sink = new CopySink(copyIn, 1);

        IOException e = assertThrows(IOException.class, () -> {
            for (int i = 0; i < 1000; i++) sink.write(row(String.valueOf(i)));
        });
        assertInstanceOf(SQLException.class, e.getCause());
        assertThrows(SQLException.class, sink::finish);
    }

    @Test
    void testAbortCancelsCopy() throws Exception {
        RecordingCopyIn copyIn = new RecordingCopyIn();
        CopySink sink = new CopySink(copyIn, 4);
        sink.write(row("1"));

        sink.abort();

        assertTrue(copyIn.isCancelled());
        assertThrows(IOException.class, () -> sink.write(row("2")));
    }
}
