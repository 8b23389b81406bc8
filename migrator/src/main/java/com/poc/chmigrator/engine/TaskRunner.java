package com.poc.chmigrator.engine;

import com.poc.chmigrator.engine.model.MigrationTask;
import com.poc.chmigrator.engine.model.TableResult;
import com.poc.chmigrator.engine.model.TableSpec;
import com.poc.chmigrator.engine.model.TaskResult;
import com.poc.chmigrator.engine.model.TaskStatus;
import com.poc.chmigrator.engine.port.DatabaseSessionFactory;
import com.poc.chmigrator.engine.port.DestinationDatabase;
import com.poc.chmigrator.engine.port.SourceDatabase;
import com.poc.chmigrator.exception.ConnectionException;
import com.poc.chmigrator.util.Formats;
import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs a task's tables in order, one at a time or on a small bounded pool, and
 * publishes lifecycle events.
 * <p>
 * A FAILED table whose spec forbids continuing halts the task: tables that have not
 * started yet are SKIPPED. Cancellation is honoured between tables and, inside
 * {@link TableMigrator}, between batches.
 */
@Slf4j
public class TaskRunner {

    private final TableMigrator tableMigrator;
    private final DatabaseSessionFactory sessions;
    private final List<MigrationEventListener> listeners;
    private final EngineSettings settings;

    public TaskRunner(TableMigrator tableMigrator, DatabaseSessionFactory sessions,
                      List<MigrationEventListener> listeners, EngineSettings settings) {
        this.tableMigrator = tableMigrator;
        this.sessions = sessions;
        this.listeners = List.copyOf(listeners);
        this.settings = settings;
    }

    public TaskResult run(MigrationTask task) {
        Instant start = Instant.now();
        List<TableSpec> tables = task.getTables();
        log.info("{} ========== MIGRATION TASK STARTED: {} ({} table(s)) ==========",
                task.logPrefix(), task.getName(), tables.size());
        publish(listener -> listener.onTaskStarted(task));

        TaskResult result;
        try {
            checkConnectivity();
            List<TableResult> results = settings.getConcurrency() > 1 && tables.size() > 1
                ? runConcurrently(task)
                : runSequentially(task);
            result = TaskResult.builder()
                .taskId(task.getId())
                .taskName(task.getName())
                .tableResults(results)
                .overallStatus(overallStatus(results, task))
                .duration(Duration.between(start, Instant.now()))
                .build();

        } catch (ConnectionException e) {
            log.error("{} Task aborted before any table started: {}", task.logPrefix(), e.getMessage(), e);
            List<TableResult> skipped = new ArrayList<>();
            tables.forEach(spec -> skipped.add(TableResult.skipped(spec, "Task aborted: " + e.getMessage())));
            result = TaskResult.builder()
                .taskId(task.getId())
                .taskName(task.getName())
                .tableResults(skipped)
                .overallStatus(TaskStatus.FAILED)
                .duration(Duration.between(start, Instant.now()))
                .taskError(e.getMessage())
                .build();
        }

        logSummary(task, result);
        TaskResult finalResult = result;
        publish(listener -> listener.onTaskCompleted(task, finalResult));
        return result;
    }

    private List<TableResult> runSequentially(MigrationTask task) {
        List<TableSpec> tables = task.getTables();
        List<TableResult> results = new ArrayList<>(tables.size());
        String haltReason = null;

        for (int i = 0; i < tables.size(); i++) {
            TableSpec spec = tables.get(i);
            log.info("{} [TABLE {}/{}] {}", task.logPrefix(), i + 1, tables.size(), spec.label());

            TableResult result;
            if (task.getCancellation().isCancelled()) {
                result = TableResult.skipped(spec, "Task cancelled");
            } else if (haltReason != null) {
                result = TableResult.skipped(spec, haltReason);
            } else {
                result = tableMigrator.migrate(spec, task.getCancellation());
                if (result.isFailed() && !spec.isContinueOnError()) {
                    haltReason = "Halted after " + spec.getSourceTable() + " failed";
                }
            }
            results.add(result);
            publishTable(task, result);
        }
        return results;
    }

    private List<TableResult> runConcurrently(MigrationTask task) {
        List<TableSpec> tables = task.getTables();
        AtomicBoolean halted = new AtomicBoolean();
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(settings.getConcurrency(), runnable -> {
            Thread thread = new Thread(runnable, "table-worker-" + task.getId() + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("{} Migrating up to {} tables concurrently", task.logPrefix(), settings.getConcurrency());

        try {
            List<Future<TableResult>> futures = new ArrayList<>(tables.size());
            for (TableSpec spec : tables) {
                futures.add(pool.submit(() -> {
                    TableResult result;
                    if (task.getCancellation().isCancelled()) {
                        result = TableResult.skipped(spec, "Task cancelled");
                    } else if (halted.get()) {
                        result = TableResult.skipped(spec, "Halted after an earlier table failed");
                    } else {
                        result = tableMigrator.migrate(spec, task.getCancellation());
                        if (result.isFailed() && !spec.isContinueOnError()) {
                            halted.set(true);
                        }
                    }
                    publishTable(task, result);
                    return result;
                }));
            }

            List<TableResult> results = new ArrayList<>(tables.size());
            boolean interrupted = false;
            for (int i = 0; i < futures.size(); i++) {
                while (true) {
                    try {
                        results.add(await(futures.get(i), tables.get(i)));
                        break;
                    } catch (InterruptedException e) {
                        if (!interrupted) {
                            log.warn("{} Interrupted; cancelling and waiting for running tables to stop", task.logPrefix());
                            task.getCancellation().cancel();
                        }
                        interrupted = true;
                    }
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            return results;

        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * An interrupt is turned into cooperative cancellation by the caller, which keeps
     * waiting so every result describes what the destination actually holds.
     */
    private TableResult await(Future<TableResult> future, TableSpec spec) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Table worker for " + spec.getSourceTable() + " crashed", e.getCause());
        }
    }

    /**
     * Opens and closes one handle on each side; failure aborts the whole task.
     */
    private void checkConnectivity() {
        try (SourceDatabase ignored = sessions.openSource()) {
            log.info("[SUCCESS] Connected to source database");
        } catch (SQLException e) {
            throw new ConnectionException("Cannot connect to source database: " + e.getMessage(), e);
        }
        try (DestinationDatabase ignored = sessions.openDestination()) {
            log.info("[SUCCESS] Connected to destination database");
        } catch (SQLException e) {
            throw new ConnectionException("Cannot connect to destination database: " + e.getMessage(), e);
        }
    }

    private TaskStatus overallStatus(List<TableResult> results, MigrationTask task) {
        boolean fatalFailure = results.stream().anyMatch(r -> r.isFailed() && !r.getTable().isContinueOnError());
        if (fatalFailure) {
            return TaskStatus.FAILED;
        }
        if (task.getCancellation().isCancelled()) {
            return TaskStatus.CANCELLED;
        }
        if (results.stream().anyMatch(TableResult::isFailed)) {
            return TaskStatus.SUCCEEDED_WITH_WARNINGS;
        }
        return TaskStatus.SUCCEEDED;
    }

    private void logSummary(MigrationTask task, TaskResult result) {
        log.info("{} ========== Migration Summary ==========", task.logPrefix());
        log.info("{} Total tables: {}", task.logPrefix(), result.getTableResults().size());
        log.info("{} Succeeded: {} | Failed: {} | Skipped: {}", task.logPrefix(),
                result.succeededCount(), result.failedCount(), result.skippedCount());
        log.info("{} Total rows: {} | Time: {}", task.logPrefix(),
                Formats.number(result.totalRowsWritten()), Formats.duration(result.getDuration()));
        if (result.getOverallStatus().isError()) {
            log.error("{} Result: {}", task.logPrefix(), result.getOverallStatus().getDisplayName());
            result.getTableResults().stream()
                .filter(TableResult::isFailed)
                .forEach(r -> log.error("{}   - {}: {}", task.logPrefix(), r.getTable().label(), r.getError().summary()));
        } else {
            log.info("{} Result: {}", task.logPrefix(), result.getOverallStatus().getDisplayName());
        }
    }

    private void publishTable(MigrationTask task, TableResult result) {
        publish(listener -> listener.onTableCompleted(task, result));
    }

    private void publish(Consumer<MigrationEventListener> event) {
        for (MigrationEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
