package io.riskwatch.ingestion.api.service;

import io.riskwatch.ingestion.api.service.sink.AnalyticalSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Write-behind buffer in front of an {@link AnalyticalSink}. Rows are buffered per table and
 * inserted when a table reaches the batch size, on {@link #flush()}, and once more on {@link #close()}.
 * All buffer mutations happen under one lock; inserts run outside it on the drained batch.
 */
public class BatchedWriter implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BatchedWriter.class);

    private final AnalyticalSink sink;
    private final ErrorMonitorService errorMonitor;
    private final int batchSize;
    private final RetryTemplate retryTemplate;

    private final Object lock = new Object();
    private final Map<String, List<Map<String, Object>>> buffers = new LinkedHashMap<>();
    private boolean closed;

    private final AtomicLong queued = new AtomicLong();
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    /**
     * @param retryTemplate attempts and backoff for one batch insert; when it gives up the batch is dropped
     */
    public BatchedWriter(AnalyticalSink sink, ErrorMonitorService errorMonitor,
                         int batchSize, RetryTemplate retryTemplate) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.sink = sink;
        this.errorMonitor = errorMonitor;
        this.batchSize = batchSize;
        this.retryTemplate = retryTemplate;
    }

    public void queue(String table, Map<String, Object> row) {
        List<Map<String, Object>> ready = null;
        boolean writeThrough;

        synchronized (lock) {
            writeThrough = closed;
            if (!writeThrough) {
                List<Map<String, Object>> buffer = buffers.computeIfAbsent(table, name -> new ArrayList<>());
                buffer.add(row);
                if (buffer.size() >= batchSize) {
                    ready = drain(table);
                }
            }
        }
        queued.incrementAndGet();

        if (writeThrough) {
            logger.warn("Writer closed, writing row for {} through", table);
            flushBatch(table, List.of(row));
        } else if (ready != null) {
            flushBatch(table, ready);
        }
    }

    /**
     * Inserts everything currently buffered. Rows already drained are never inserted twice.
     */
    public void flush() {
        Map<String, List<Map<String, Object>>> drained = new LinkedHashMap<>();
        synchronized (lock) {
            for (String table : List.copyOf(buffers.keySet())) {
                List<Map<String, Object>> rows = drain(table);
                if (!rows.isEmpty()) {
                    drained.put(table, rows);
                }
            }
        }
        drained.forEach(this::flushBatch);
    }

    /**
     * Terminal flush, executed once. Later rows are written through without buffering.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) return;
            closed = true;
        }
        logger.info("Flushing write-behind buffers on shutdown");
        flush();
    }

    public WriterStats getStats() {
        Map<String, Integer> pending = new LinkedHashMap<>();
        synchronized (lock) {
            buffers.forEach((table, rows) -> pending.put(table, rows.size()));
        }
        return new WriterStats(queued.get(), written.get(), dropped.get(), pending);
    }

    // caller holds the lock
    private List<Map<String, Object>> drain(String table) {
        List<Map<String, Object>> rows = buffers.get(table);
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        buffers.put(table, new ArrayList<>());
        return rows;
    }

    void flushBatch(String table, List<Map<String, Object>> rows) {
        try {
            retryTemplate.execute(context -> {
                try {
                    insertOrReject(table, rows);
                } catch (RuntimeException e) {
                    logger.warn("Insert into {} failed (attempt {}): {}", table, context.getRetryCount() + 1, e.getMessage());
                    throw e;
                }
                written.addAndGet(rows.size());
                logger.debug("Flushed {} rows to {}", rows.size(), table);
                return null;
            }, context -> {
                drop(table, rows, context.getLastThrowable(), context.getRetryCount());
                return null;
            });
        } catch (BackOffInterruptedException e) {
            logger.warn("Interrupted while backing off, giving up on the batch for {}", table);
            drop(table, rows, e, -1);
        }
    }

    private void insertOrReject(String table, List<Map<String, Object>> rows) {
        List<String> errors = sink.insertRows(table, rows);
        if (!errors.isEmpty()) {
            throw new IllegalStateException(errors.size() + " rows rejected: " + errors);
        }
    }

    private void drop(String table, List<Map<String, Object>> rows, Throwable cause, int attempts) {
        dropped.addAndGet(rows.size());
        logger.error("Dropping {} rows for {} after {} attempts: {}", rows.size(), table, attempts,
                cause != null ? cause.getMessage() : "unknown error");
        errorMonitor.recordFailure("analytics_write:" + table, table,
                cause != null ? cause : new IllegalStateException("batch dropped"),
                Map.of("rows", rows.size(), "attempts", attempts));
    }

    public record WriterStats(long queued, long written, long dropped, Map<String, Integer> pendingByTable) {}
}
