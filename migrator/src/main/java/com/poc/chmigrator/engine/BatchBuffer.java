package com.poc.chmigrator.engine;

import com.poc.chmigrator.engine.model.Batch;
import com.poc.chmigrator.engine.model.Row;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Accumulates streamed rows and cuts them into batches of exactly
 * {@code batchSize}, plus one final partial batch at end of stream or on a flush
 * timeout. Not thread-safe; owned by the writing side of one table migration.
 */
public class BatchBuffer {

    private final int batchSize;
    private final LongSupplier nanoClock;
    private List<Row> pending;
    private int nextSequence = 1;

    /**
     * Arrival time of the oldest buffered row, meaningful only while rows are pending.
     */
    private long oldestArrivalNanos;
    private long lastArrivalNanos;

    public BatchBuffer(int batchSize) {
        this(batchSize, System::nanoTime);
    }

    BatchBuffer(int batchSize, LongSupplier nanoClock) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.batchSize = batchSize;
        this.nanoClock = nanoClock;
        this.pending = new ArrayList<>(batchSize);
    }

    public void addAll(List<Row> rows) {
        if (rows.isEmpty()) {
            return;
        }
        long now = nanoClock.getAsLong();
        if (pending.isEmpty()) {
            oldestArrivalNanos = now;
        }
        lastArrivalNanos = now;
        pending.addAll(rows);
    }

    /**
     * Time left before the buffered rows have waited {@code flushTimeout}; zero when
     * they are due and {@code flushTimeout} itself when nothing is buffered.
     */
    public Duration remainingWait(Duration flushTimeout) {
        if (pending.isEmpty()) {
            return flushTimeout;
        }
        long waited = nanoClock.getAsLong() - oldestArrivalNanos;
        long left = flushTimeout.toNanos() - waited;
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public boolean hasFullBatch() {
        return pending.size() >= batchSize;
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    public int pendingRows() {
        return pending.size();
    }

    /**
     * Removes the oldest {@code batchSize} rows as a batch.
     */
    public Batch takeFullBatch() {
        if (!hasFullBatch()) {
            throw new IllegalStateException("Only " + pending.size() + " rows buffered");
        }
        List<Row> rows = new ArrayList<>(pending.subList(0, batchSize));
        pending = new ArrayList<>(pending.subList(batchSize, pending.size()));
        // Full batches are cut as soon as they form, so a remainder always comes from the latest chunk.
        oldestArrivalNanos = lastArrivalNanos;
        return new Batch(nextSequence++, rows);
    }

    /**
     * Removes every buffered row as one batch, regardless of size.
     */
    public Batch drain() {
        if (pending.isEmpty()) {
            throw new IllegalStateException("Nothing buffered");
        }
        List<Row> rows = pending;
        pending = new ArrayList<>(batchSize);
        return new Batch(nextSequence++, rows);
    }
}
