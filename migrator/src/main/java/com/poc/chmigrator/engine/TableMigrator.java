package com.poc.chmigrator.engine;

import com.poc.chmigrator.engine.model.Batch;
import com.poc.chmigrator.engine.model.CancellationToken;
import com.poc.chmigrator.engine.model.ColumnDef;
import com.poc.chmigrator.engine.model.Row;
import com.poc.chmigrator.engine.model.TableResult;
import com.poc.chmigrator.engine.model.TableSpec;
import com.poc.chmigrator.engine.model.TableState;
import com.poc.chmigrator.engine.model.VerificationResult;
import com.poc.chmigrator.engine.port.DatabaseSessionFactory;
import com.poc.chmigrator.engine.port.DestinationDatabase;
import com.poc.chmigrator.engine.port.SourceDatabase;
import com.poc.chmigrator.exception.ConnectionException;
import com.poc.chmigrator.exception.MigrationException;
import com.poc.chmigrator.exception.ReadException;
import com.poc.chmigrator.exception.VerificationException;
import com.poc.chmigrator.util.Formats;
import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Migrates one table end to end: sync, stream, write, verify.
 * <p>
 * Reading and writing are pipelined. A reader thread pushes row groups into a
 * bounded queue and the calling thread drains it into the batch writer, so a slow
 * destination stalls the cursor instead of filling memory. Any table-fatal error
 * ends the table as FAILED; nothing is rolled back.
 */
@Slf4j
public class TableMigrator {

    /**
     * How long the reader waits on a full queue before re-checking whether the
     * writer gave up.
     */
    private static final long OFFER_POLL_MS = 200;

    private final DatabaseSessionFactory sessions;
    private final SchemaSynchronizer synchronizer;
    private final Verifier verifier;
    private final TypeMapper typeMapper;
    private final EngineSettings settings;

    public TableMigrator(DatabaseSessionFactory sessions, SchemaSynchronizer synchronizer, Verifier verifier,
                         TypeMapper typeMapper, EngineSettings settings) {
        this.sessions = sessions;
        this.synchronizer = synchronizer;
        this.verifier = verifier;
        this.typeMapper = typeMapper;
        this.settings = settings;
    }

    /**
     * Runs the table's state machine to a terminal state. Never throws for
     * table-level failures; they are recorded on the result.
     */
    public TableResult migrate(TableSpec spec, CancellationToken cancellation) {
        TableRun run = new TableRun(spec);
        log.info("=".repeat(100));
        log.info("[START] Table: {}", spec.label());
        log.info("=".repeat(100));

        TableResult result;
        try (SourceDatabase source = openSource(spec); DestinationDatabase destination = openDestination(spec)) {
            result = execute(run, source, destination, cancellation);
        } catch (MigrationException e) {
            result = run.fail(e);
        } catch (RuntimeException e) {
            log.error("Unexpected error migrating {}: {}", spec.getSourceTable(), e.getMessage(), e);
            result = run.fail(e);
        }

        logOutcome(result);
        return result;
    }

    private TableResult execute(TableRun run, SourceDatabase source, DestinationDatabase destination,
                                CancellationToken cancellation) {
        TableSpec spec = run.getSpec();
        if (cancellation.isCancelled()) {
            return run.skip("Task cancelled");
        }

        long sourceRows = countSource(spec, source);
        run.sourceCount(sourceRows);
        if (sourceRows == 0 && settings.isSkipEmptyTables()) {
            log.warn("[WARNING] Empty table {}, skipping", spec.getSourceTable());
            return run.skip("Source table is empty");
        }

        run.transition(TableState.SYNCING);
        log.info("[STEP 1/3] Synchronizing schema...");
        List<ColumnDef> columns = synchronizer.synchronize(spec, source, destination);

        run.transition(TableState.STREAMING);
        log.info("[STEP 2/3] Migrating data...");
        boolean completed = stream(run, columns, source, destination, sourceRows, cancellation);
        if (!completed) {
            log.warn("Cancelled while streaming {} after {} rows", spec.getSourceTable(),
                    Formats.number(run.getRowsWritten()));
            return run.skip("Task cancelled while streaming");
        }

        if (!spec.isVerify()) {
            return run.succeed();
        }

        run.transition(TableState.VERIFYING);
        log.info("[STEP 3/3] Verifying...");
        VerificationResult verification = verifier.verify(
            spec.getSourceTable(), spec.getDestinationTable(), source, destination);
        run.counts(verification.sourceCount(), verification.destinationCount(), verification.match());
        if (!verification.match()) {
            return run.fail(new VerificationException(String.format(
                "Row counts differ: source %d, destination %d (diff %d)",
                verification.sourceCount(), verification.destinationCount(), verification.difference())));
        }
        return run.succeed();
    }

    /**
     * Streams every row into the destination.
     *
     * @return false when cancellation stopped the stream early
     */
    private boolean stream(TableRun run, List<ColumnDef> columns, SourceDatabase source,
                           DestinationDatabase destination, long expectedRows, CancellationToken cancellation) {
        TableSpec spec = run.getSpec();
        BatchWriter writer = new BatchWriter(destination, spec.getDestinationTable(), columns, typeMapper, settings);
        BatchBuffer buffer = new BatchBuffer(spec.getBatchSize());
        ProgressReporter progress = new ProgressReporter(
            spec.getSourceTable(), expectedRows, spec.getBatchSize(), settings.getProgressLogInterval());

        StreamingReader reader = new StreamingReader(source, settings);
        reader.open(spec.getSourceTable(), settings.fetchSizeFor(spec.getBatchSize()), columns);

        BlockingQueue<Chunk> queue = new ArrayBlockingQueue<>(settings.getQueueCapacity());
        Producer producer = new Producer(reader, queue, cancellation);
        Thread readerThread = new Thread(producer, "reader-" + spec.getSourceTable());
        readerThread.setDaemon(true);
        readerThread.start();

        try {
            while (true) {
                Chunk chunk = nextChunk(queue, buffer);
                if (chunk == null) {
                    write(run, writer, buffer.drain(), progress);
                    continue;
                }
                if (chunk.error != null) {
                    throw chunk.error;
                }
                if (chunk.end) {
                    break;
                }

                run.rowsRead(chunk.rows.size());
                buffer.addAll(chunk.rows);
                while (buffer.hasFullBatch()) {
                    write(run, writer, buffer.takeFullBatch(), progress);
                }
                if (cancellation.isCancelled()) {
                    return false;
                }
            }

            if (cancellation.isCancelled()) {
                return false;
            }
            if (!buffer.isEmpty()) {
                write(run, writer, buffer.drain(), progress);
            }
            progress.finished(run.getRowsWritten());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReadException("Interrupted while waiting for rows of " + spec.getSourceTable(), e);
        } finally {
            producer.stop();
            readerThread.interrupt();
            awaitReader(readerThread, spec);
        }
    }

    /**
     * Waits for the next chunk. Returns null once the oldest buffered row has waited
     * the flush timeout, so a partial batch never sits longer than that however often
     * small chunks arrive.
     */
    private Chunk nextChunk(BlockingQueue<Chunk> queue, BatchBuffer buffer) throws InterruptedException {
        Duration flushTimeout = settings.getFlushTimeout();
        if (flushTimeout.isZero() || flushTimeout.isNegative() || buffer.isEmpty()) {
            return queue.take();
        }
        long remainingNanos = buffer.remainingWait(flushTimeout).toNanos();
        Chunk chunk = remainingNanos > 0 ? queue.poll(remainingNanos, TimeUnit.NANOSECONDS) : null;
        if (chunk == null) {
            log.debug("Flush timeout reached with {} rows buffered", buffer.pendingRows());
        }
        return chunk;
    }

    private void write(TableRun run, BatchWriter writer, Batch batch, ProgressReporter progress) {
        int written = writer.write(batch);
        run.batchWritten(written);
        progress.batchWritten(run.getBatchesWritten(), run.getRowsWritten());
    }

    private long countSource(TableSpec spec, SourceDatabase source) {
        try {
            return source.countRows(spec.getSourceTable());
        } catch (SQLException e) {
            throw new ReadException("Failed to count rows of " + spec.getSourceTable() + ": " + e.getMessage(), e);
        }
    }

    private SourceDatabase openSource(TableSpec spec) {
        try {
            return sessions.openSource();
        } catch (SQLException e) {
            throw new ConnectionException("Cannot open source connection for " + spec.getSourceTable(), e);
        }
    }

    private DestinationDatabase openDestination(TableSpec spec) {
        try {
            return sessions.openDestination();
        } catch (SQLException e) {
            throw new ConnectionException("Cannot open destination connection for " + spec.getDestinationTable(), e);
        }
    }

    private void awaitReader(Thread readerThread, TableSpec spec) {
        try {
            readerThread.join(TimeUnit.SECONDS.toMillis(30));
            if (readerThread.isAlive()) {
                log.warn("Reader thread for {} did not stop in time", spec.getSourceTable());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void logOutcome(TableResult result) {
        log.info("=".repeat(100));
        switch (result.getStatus()) {
            case SUCCEEDED:
                log.info("[SUCCESS] {} completed in {} ({} rows)", result.getTable().label(),
                        Formats.duration(result.getDuration()), Formats.number(result.getRowsWritten()));
                break;
            case SKIPPED:
                log.warn("[SKIPPED] {}: {}", result.getTable().label(), result.getSkipReason());
                break;
            default:
                log.error("[ERROR] {} failed: {}", result.getTable().label(), result.getError().summary());
                break;
        }
        log.info("=".repeat(100));
    }

    /**
     * Item passed from the reader thread: rows, end of stream, or the reader's failure.
     */
    private static final class Chunk {
        private static final Chunk END = new Chunk(null, null, true);

        private final List<Row> rows;
        private final MigrationException error;
        private final boolean end;

        private Chunk(List<Row> rows, MigrationException error, boolean end) {
            this.rows = rows;
            this.error = error;
            this.end = end;
        }

        static Chunk rows(List<Row> rows) {
            return new Chunk(rows, null, false);
        }

        static Chunk failure(MigrationException error) {
            return new Chunk(null, error, false);
        }
    }

    /**
     * Reader side of the pipeline. Blocks on a full queue, which is what throttles
     * the source cursor.
     */
    private static final class Producer implements Runnable {
        private final StreamingReader reader;
        private final BlockingQueue<Chunk> queue;
        private final CancellationToken cancellation;
        private volatile boolean stopped;

        Producer(StreamingReader reader, BlockingQueue<Chunk> queue, CancellationToken cancellation) {
            this.reader = reader;
            this.queue = queue;
            this.cancellation = cancellation;
        }

        void stop() {
            stopped = true;
        }

        @Override
        public void run() {
            try {
                while (!stopped && !cancellation.isCancelled()) {
                    Optional<List<Row>> rows = reader.nextBatch();
                    if (rows.isEmpty()) {
                        break;
                    }
                    if (!offer(Chunk.rows(rows.get()))) {
                        return;
                    }
                }
                offer(Chunk.END);
            } catch (MigrationException e) {
                offerQuietly(Chunk.failure(e));
            } catch (RuntimeException e) {
                offerQuietly(Chunk.failure(new ReadException("Reader failed: " + e.getMessage(), e)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                reader.close();
            }
        }

        private boolean offer(Chunk chunk) throws InterruptedException {
            while (!stopped) {
                if (queue.offer(chunk, OFFER_POLL_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
            return false;
        }

        private void offerQuietly(Chunk chunk) {
            try {
                offer(chunk);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
