package com.poc.chmigrator.engine;

import com.poc.chmigrator.engine.fake.InMemoryDestinationDatabase;
import com.poc.chmigrator.engine.fake.InMemorySessionFactory;
import com.poc.chmigrator.engine.fake.InMemorySourceDatabase;
import com.poc.chmigrator.engine.model.MigrationTask;
import com.poc.chmigrator.engine.model.Row;
import com.poc.chmigrator.engine.model.TableResult;
import com.poc.chmigrator.engine.model.TableSpec;
import com.poc.chmigrator.engine.model.TableState;
import com.poc.chmigrator.engine.model.TaskResult;
import com.poc.chmigrator.engine.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static com.poc.chmigrator.engine.fake.InMemorySourceDatabase.column;
import static org.assertj.core.api.Assertions.assertThat;

class TaskRunnerTest {

    private InMemorySourceDatabase source;
    private InMemoryDestinationDatabase destination;
    private InMemorySessionFactory sessions;
    private RecordingListener events;
    private EngineSettings settings;

    @BeforeEach
    void setUp() {
        source = new InMemorySourceDatabase();
        destination = new InMemoryDestinationDatabase();
        sessions = new InMemorySessionFactory(source, destination);
        events = new RecordingListener();
        settings = EngineSettings.builder()
            .flushTimeout(Duration.ZERO)
            .retryDelay(Duration.ZERO)
            .progressLogInterval(Duration.ofHours(1))
            .build();

        source.sequenceTable("users", 25);
        source.sequenceTable("orders", 40);
        source.sequenceTable("items", 10);
        source.table("legacy_events",
            List.of(column("id", "bigint", false), column("shape", "geometry", true)),
            List.of("id"),
            List.of(Row.of(1L, new byte[]{1})));
    }

    private TaskRunner runner(EngineSettings engineSettings, List<MigrationEventListener> listeners) {
        TypeMapper typeMapper = new TypeMapper(StandardCharsets.UTF_8);
        TableMigrator tableMigrator = new TableMigrator(sessions,
            new SchemaSynchronizer(typeMapper, engineSettings), new Verifier(), typeMapper, engineSettings);
        return new TaskRunner(tableMigrator, sessions, listeners, engineSettings);
    }

    private TaskResult run(TableSpec... tables) {
        return runner(settings, List.of(events)).run(task(tables));
    }

    private static MigrationTask task(TableSpec... tables) {
        return MigrationTask.builder().id(7L).name("nightly").tables(List.of(tables)).build();
    }

    private static TableSpec spec(String table, boolean continueOnError) {
        return TableSpec.builder().sourceTable(table).batchSize(10).verify(true)
            .continueOnError(continueOnError).build();
    }

    @Test
    void migratesEveryTableInOrder() {
        TaskResult result = run(spec("users", false), spec("orders", false), spec("items", false));

        assertThat(result.getOverallStatus()).isEqualTo(TaskStatus.SUCCEEDED);
        assertThat(result.getTableResults()).extracting(r -> r.getTable().getSourceTable())
            .containsExactly("users", "orders", "items");
        assertThat(result.succeededCount()).isEqualTo(3);
        assertThat(result.totalRowsWritten()).isEqualTo(75);
        assertThat(result.getTaskId()).isEqualTo(7L);
    }

    @Test
    void failedTableHaltsTheRemainingTables() {
        TaskResult result = run(spec("users", false), spec("legacy_events", false), spec("orders", false));

        assertThat(result.getOverallStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(result.getTableResults()).extracting(TableResult::getStatus)
            .containsExactly(TableState.SUCCEEDED, TableState.FAILED, TableState.SKIPPED);
        assertThat(result.getTableResults().get(2).getSkipReason()).contains("legacy_events");
        assertThat(destination.insertSizes("orders")).isEmpty();
    }

    @Test
    void continueOnErrorLetsTheNextTableRun() {
        TaskResult result = run(spec("legacy_events", true), spec("orders", false));

        assertThat(result.getOverallStatus()).isEqualTo(TaskStatus.SUCCEEDED_WITH_WARNINGS);
        assertThat(result.getTableResults()).extracting(TableResult::getStatus)
            .containsExactly(TableState.FAILED, TableState.SUCCEEDED);
        assertThat(result.firstFailure()).get()
            .extracting(r -> r.getTable().getSourceTable()).isEqualTo("legacy_events");
        assertThat(destination.rows("orders")).hasSize(40);
    }

    @Test
    void unreachableDestinationAbortsTheTaskBeforeAnyTable() {
        sessions.destinationUnreachable(new SQLTransientConnectionException("Connection refused"));

        TaskResult result = run(spec("users", false), spec("orders", false));

        assertThat(result.getOverallStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(result.getTaskError()).contains("destination").contains("Connection refused");
        assertThat(result.getTableResults()).allMatch(TableResult::isSkipped);
        assertThat(source.cursorsOpened()).isZero();
        assertThat(events.names).containsExactly("started", "completed");
    }

    @Test
    void cancelledTaskSkipsTheRemainingTables() {
        MigrationTask task = task(spec("users", false), spec("orders", false), spec("items", false));
        MigrationEventListener cancelAfterFirst = new MigrationEventListener() {
            @Override
            public void onTableCompleted(MigrationTask t, TableResult result) {
                t.getCancellation().cancel();
            }
        };

        TaskResult result = runner(settings, List.of(cancelAfterFirst, events)).run(task);

        assertThat(result.getOverallStatus()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(result.getTableResults()).extracting(TableResult::getStatus)
            .containsExactly(TableState.SUCCEEDED, TableState.SKIPPED, TableState.SKIPPED);
    }

    @Test
    void emitsLifecycleEventsForTheTaskAndEveryTable() {
        run(spec("users", false), spec("legacy_events", false), spec("orders", false));

        assertThat(events.names).containsExactly("started", "table:users", "table:legacy_events",
            "table:orders", "completed");
        assertThat(events.completed.failedCount()).isEqualTo(1);
        assertThat(events.completed.skippedCount()).isEqualTo(1);
    }

    @Test
    void failingListenerDoesNotAffectTheMigration() {
        MigrationEventListener broken = new MigrationEventListener() {
            @Override
            public void onTaskStarted(MigrationTask task) {
                throw new IllegalStateException("webhook down");
            }

            @Override
            public void onTableCompleted(MigrationTask task, TableResult result) {
                throw new IllegalStateException("webhook down");
            }
        };

        TaskResult result = runner(settings, List.of(broken, events)).run(task(spec("users", false)));

        assertThat(result.getOverallStatus()).isEqualTo(TaskStatus.SUCCEEDED);
        assertThat(events.names).containsExactly("started", "table:users", "completed");
    }

    @Test
    void concurrentRunKeepsResultsInTaskOrder() {
        TaskRunner concurrent = runner(settings.toBuilder().concurrency(3).build(), List.of(events));

        TaskResult result = concurrent.run(task(spec("users", false), spec("orders", false), spec("items", false)));

        assertThat(result.getOverallStatus()).isEqualTo(TaskStatus.SUCCEEDED);
        assertThat(result.getTableResults()).extracting(r -> r.getTable().getSourceTable())
            .containsExactly("users", "orders", "items");
        assertThat(destination.rows("users")).hasSize(25);
        assertThat(destination.rows("orders")).hasSize(40);
        assertThat(destination.rows("items")).hasSize(10);
        assertThat(events.names.stream().filter(name -> name.startsWith("table:")).collect(Collectors.toList()))
            .hasSize(3);
    }

    @Test
    void concurrentRunWithContinueOnErrorFinishesEveryTable() {
        TaskRunner concurrent = runner(settings.toBuilder().concurrency(2).build(), List.of(events));

        TaskResult result = concurrent.run(task(spec("legacy_events", true), spec("users", true), spec("items", true)));

        assertThat(result.getOverallStatus()).isEqualTo(TaskStatus.SUCCEEDED_WITH_WARNINGS);
        assertThat(result.failedCount()).isEqualTo(1);
        assertThat(result.succeededCount()).isEqualTo(2);
    }

    @Test
    void interruptDuringConcurrentRunCancelsAndWaitsForRunningTables() throws Exception {
        source.sequenceTable("slow", 40);
        CountDownLatch streaming = new CountDownLatch(1);
        source.onRow("slow", index -> {
            if (index == 5) {
                streaming.countDown();
            }
            sleep(20);
        });
        TaskRunner concurrent = runner(settings.toBuilder().concurrency(2).build(), List.of(events));
        MigrationTask task = task(spec("slow", false), spec("users", false), spec("orders", false), spec("items", false));

        AtomicReference<TaskResult> outcome = new AtomicReference<>();
        AtomicBoolean interruptRestored = new AtomicBoolean();
        Thread caller = new Thread(() -> {
            outcome.set(concurrent.run(task));
            interruptRestored.set(Thread.currentThread().isInterrupted());
        }, "task-caller");
        caller.start();
        assertThat(streaming.await(5, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        caller.join(10_000);

        assertThat(caller.isAlive()).isFalse();
        assertThat(interruptRestored).isTrue();
        TaskResult result = outcome.get();
        assertThat(result.getOverallStatus()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(result.getTableResults()).extracting(r -> r.getTable().getSourceTable())
            .containsExactly("slow", "users", "orders", "items");
        assertThat(result.getTableResults().get(0).getStatus()).isEqualTo(TableState.SKIPPED);
        assertThat(destination.rows("slow")).hasSizeLessThan(40);
        for (TableResult table : result.getTableResults()) {
            assertThat(destination.rows(table.getTable().getDestinationTable()))
                .as(table.getTable().getSourceTable())
                .hasSize((int) table.getRowsWritten());
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class RecordingListener implements MigrationEventListener {
        private final List<String> names = Collections.synchronizedList(new ArrayList<>());
        private volatile TaskResult completed;

        @Override
        public void onTaskStarted(MigrationTask task) {
            names.add("started");
        }

        @Override
        public void onTableCompleted(MigrationTask task, TableResult result) {
            names.add("table:" + result.getTable().getSourceTable());
        }

        @Override
        public void onTaskCompleted(MigrationTask task, TaskResult result) {
            names.add("completed");
            completed = result;
        }
    }
}
