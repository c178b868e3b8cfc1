package org.pgbulk.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.copy.CopyIn;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.sql.SQLException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The single COPY channel of a load. Any number of file pipelines hand encoded rows to
 * {@link #write(byte[])}; one drainer thread owns the {@link CopyIn} and writes them in the
 * order they were queued. The queue is bounded, so fast producers block until the database
 * catches up.
 */
public class CopySink {

    private static final Logger LOG = LogManager.getLogger(CopySink.class.getName());

    private static final byte[] END = new byte[0];
    private static final long OFFER_TIMEOUT_MS = 100;

    private final CopyIn copyIn;
    private final BlockingQueue<byte[]> queue;
    private final ExecutorService drainer;
    private final Future<?> drained;
    private final AtomicLong rows = new AtomicLong();

    private volatile Exception failure;
    private volatile boolean closed;

    public CopySink(CopyIn copyIn, int capacity) {
        this.copyIn = copyIn;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.drainer = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "copy-sink");
            thread.setDaemon(true);
            return thread;
        });
        this.drained = drainer.submit(this::drain);
    }

    /**
     * Queues one encoded row, blocking while the queue is full.
     *
     * @throws IOException when the COPY channel has already failed or the sink is closed
     */
    public void write(byte[] row) throws IOException {
        if (closed) throw new IOException("Copy sink is closed");
        checkFailure();
        try {
            while (!queue.offer(row, OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                checkFailure();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while writing to the copy sink");
        }
    }

    /**
     * Flushes every queued row and completes the COPY.
     *
     * @return number of rows the server reports as copied
     */
    public long finish() throws SQLException, IOException {
        closed = true;
        try {
            while (!drained.isDone() && !queue.offer(END, OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                LOG.trace("Waiting for room to close the copy queue");
            }
            drained.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while finishing the copy");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SQLException) throw (SQLException) cause;
            throw new IOException("Copy sink failed", cause);
        } finally {
            drainer.shutdown();
        }
        if (failure != null) {
            if (failure instanceof SQLException) throw (SQLException) failure;
            throw new IOException("Copy sink failed", failure);
        }

        long copied = copyIn.endCopy();
        LOG.debug("Copy finished: {} rows queued, {} rows copied", rows.get(), copied);
        return copied;
    }

    /**
     * Stops the drainer and cancels the COPY so the connection can roll back.
     */
    public void abort() {
        closed = true;
        drainer.shutdownNow();
        try {
            if (copyIn.isActive()) copyIn.cancelCopy();
        } catch (SQLException e) {
            LOG.warn("Could not cancel copy: {}", e.getMessage());
        }
    }

    public long getRowsWritten() {
        return rows.get();
    }

    private Void drain() throws SQLException, InterruptedException {
        try {
            while (true) {
                byte[] row = queue.take();
                if (row == END) return null;
                copyIn.writeToCopy(row, 0, row.length);
                rows.incrementAndGet();
            }
        } catch (SQLException | RuntimeException e) {
            failure = e;
            queue.clear();
            throw e;
        }
    }

    private void checkFailure() throws IOException {
        if (failure != null) throw new IOException("Copy sink failed", failure);
    }
}
