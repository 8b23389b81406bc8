package com.poc.chmigrator.engine;

import com.poc.chmigrator.engine.fake.InMemoryDestinationDatabase;
import com.poc.chmigrator.engine.fake.InMemorySessionFactory;
import com.poc.chmigrator.engine.fake.InMemorySourceDatabase;
import com.poc.chmigrator.engine.model.CancellationToken;
import com.poc.chmigrator.engine.model.CellValue;
import com.poc.chmigrator.engine.model.Row;
import com.poc.chmigrator.engine.model.TableResult;
import com.poc.chmigrator.engine.model.TableSpec;
import com.poc.chmigrator.engine.model.TableState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.sql.SQLNonTransientException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.poc.chmigrator.engine.fake.InMemorySourceDatabase.column;
import static org.assertj.core.api.Assertions.assertThat;

class TableMigratorTest {

    private InMemorySourceDatabase source;
    private InMemoryDestinationDatabase destination;
    private InMemorySessionFactory sessions;
    private EngineSettings settings;

    @BeforeEach
    void setUp() {
        source = new InMemorySourceDatabase();
        destination = new InMemoryDestinationDatabase();
        sessions = new InMemorySessionFactory(source, destination);
        settings = EngineSettings.builder()
            .flushTimeout(Duration.ZERO)
            .retryDelay(Duration.ZERO)
            .writeMaxAttempts(3)
            .progressLogInterval(Duration.ofHours(1))
            .build();
    }

    private TableMigrator migrator(EngineSettings engineSettings) {
        TypeMapper typeMapper = new TypeMapper(StandardCharsets.UTF_8);
        return new TableMigrator(sessions, new SchemaSynchronizer(typeMapper, engineSettings), new Verifier(),
            typeMapper, engineSettings);
    }

    private TableResult migrate(TableSpec spec) {
        return migrator(settings).migrate(spec, new CancellationToken());
    }

    private static TableSpec spec(String table, int batchSize, boolean verify) {
        return TableSpec.builder().sourceTable(table).batchSize(batchSize).verify(verify).build();
    }

    @Test
    void writesFullBatchesThenTheRemainder() {
        source.sequenceTable("users", 25_000);

        TableResult result = migrate(spec("users", 10_000, true));

        assertThat(result.getStatus()).isEqualTo(TableState.SUCCEEDED);
        assertThat(destination.insertSizes("users")).containsExactly(10_000, 10_000, 5_000);
        assertThat(result.getRowsRead()).isEqualTo(25_000);
        assertThat(result.getRowsWritten()).isEqualTo(25_000);
        assertThat(result.getBatchesWritten()).isEqualTo(3);
        assertThat(result.getSourceCount()).isEqualTo(25_000);
        assertThat(result.getDestinationCount()).isEqualTo(25_000);
        assertThat(result.isVerified()).isTrue();
        assertThat(result.getError()).isNull();
    }

    @Test
    void numberOfWritesIsRowCountDividedByBatchSizeRoundedUp() {
        int[][] cases = {{1, 1}, {7, 3}, {9, 3}, {10, 3}, {100, 7}, {64, 64}};
        for (int[] c : cases) {
            int rows = c[0];
            int batchSize = c[1];
            String table = "t_" + rows + "_" + batchSize;
            source.sequenceTable(table, rows);

            migrate(spec(table, batchSize, false));

            List<Integer> sizes = destination.insertSizes(table);
            int expectedCalls = (rows + batchSize - 1) / batchSize;
            int expectedLast = rows % batchSize == 0 ? batchSize : rows % batchSize;
            assertThat(sizes).as(table).hasSize(expectedCalls);
            assertThat(sizes.get(sizes.size() - 1)).as(table).isEqualTo(expectedLast);
            assertThat(sizes.subList(0, sizes.size() - 1)).as(table).allMatch(size -> size == batchSize);
        }
    }

    @Test
    void preservesSourceOrder() {
        source.sequenceTable("events", 1_000);

        migrate(spec("events", 64, false));

        List<List<CellValue>> rows = destination.rows("events");
        assertThat(rows).hasSize(1_000);
        for (int i = 0; i < rows.size(); i++) {
            assertThat(rows.get(i).get(0)).isEqualTo(CellValue.ofInteger(i + 1L));
        }
    }

    @Test
    void unsupportedColumnTypeFailsBeforeTheDestinationIsTouched() {
        source.table("legacy_events",
            List.of(column("id", "bigint", false), column("shape", "geometry", true)),
            List.of("id"),
            List.of(Row.of(1L, new byte[]{1})));

        TableResult result = migrate(spec("legacy_events", 100, true));

        assertThat(result.getStatus()).isEqualTo(TableState.FAILED);
        assertThat(result.getError().getType()).isEqualTo("UnsupportedTypeException");
        assertThat(result.getError().getMessage()).contains("shape").contains("geometry");
        assertThat(result.getError().getFailedState()).isEqualTo(TableState.SYNCING);
        assertThat(destination.ddl()).isEmpty();
        assertThat(destination.insertCalls()).isZero();
    }

    @Test
    void keepsCommittedBatchesWhenTheDestinationStaysUnreachable() {
        source.sequenceTable("orders", 50_000);
        destination.failInserts(call -> call >= 3 ? new SQLTransientConnectionException("Connection refused") : null);

        TableResult result = migrate(spec("orders", 10_000, true));

        assertThat(result.getStatus()).isEqualTo(TableState.FAILED);
        assertThat(result.getRowsWritten()).isEqualTo(20_000);
        assertThat(result.getBatchesWritten()).isEqualTo(2);
        assertThat(result.getError().getType()).isEqualTo("WriteException");
        assertThat(result.getError().getFailedState()).isEqualTo(TableState.STREAMING);
        assertThat(result.getError().getRootCause()).contains("Connection refused");
        assertThat(destination.insertCalls()).isEqualTo(2 + settings.getWriteMaxAttempts());
        assertThat(destination.rows("orders")).hasSize(20_000);
    }

    @Test
    void transientInsertFailureIsRetriedTransparently() {
        source.sequenceTable("orders", 30);
        destination.failInserts(call -> call == 2 ? new SQLTransientConnectionException("reset") : null);

        TableResult result = migrate(spec("orders", 10, true));

        assertThat(result.getStatus()).isEqualTo(TableState.SUCCEEDED);
        assertThat(destination.insertCalls()).isEqualTo(4);
        assertThat(destination.rows("orders")).hasSize(30);
    }

    @Test
    void nonTransientInsertFailureIsNotRetried() {
        source.sequenceTable("orders", 30);
        destination.failInserts(call -> new SQLNonTransientException("Code: 60. Table does not exist"));

        TableResult result = migrate(spec("orders", 10, false));

        assertThat(result.getStatus()).isEqualTo(TableState.FAILED);
        assertThat(destination.insertCalls()).isEqualTo(1);
        assertThat(result.getRowsWritten()).isZero();
    }

    @Test
    void rowsInsertedDuringMigrationFailVerificationWithoutRollback() {
        source.sequenceTable("accounts", 10);
        source.onRow("accounts", index -> {
            if (index == 0) {
                source.insert("accounts", Row.of(11L));
            }
        });

        TableResult result = migrate(spec("accounts", 4, true));

        assertThat(result.getStatus()).isEqualTo(TableState.FAILED);
        assertThat(result.getError().getType()).isEqualTo("VerificationException");
        assertThat(result.getError().getFailedState()).isEqualTo(TableState.VERIFYING);
        assertThat(result.getSourceCount()).isEqualTo(11);
        assertThat(result.getDestinationCount()).isEqualTo(10);
        assertThat(result.isVerified()).isFalse();
        assertThat(destination.rows("accounts")).hasSize(10);
    }

    @Test
    void emptyTableIsSkippedWithoutTouchingTheDestination() {
        source.sequenceTable("empty", 0);

        TableResult result = migrate(spec("empty", 100, true));

        assertThat(result.getStatus()).isEqualTo(TableState.SKIPPED);
        assertThat(result.getSkipReason()).contains("empty");
        assertThat(destination.ddl()).isEmpty();
        assertThat(destination.insertCalls()).isZero();
    }

    @Test
    void emptyTableIsCreatedWhenSkippingIsDisabled() {
        source.sequenceTable("empty", 0);

        TableResult result = migrator(settings.toBuilder().skipEmptyTables(false).build())
            .migrate(spec("empty", 100, true), new CancellationToken());

        assertThat(result.getStatus()).isEqualTo(TableState.SUCCEEDED);
        assertThat(destination.ddl()).containsExactly("create empty");
        assertThat(destination.insertCalls()).isZero();
        assertThat(result.getDestinationCount()).isZero();
    }

    @Test
    void valueOutsideTheDestinationTypeFailsTheTable() {
        source.table("flags",
            List.of(column("id", "int", false), column("level", "tinyint", false)),
            List.of("id"),
            List.of(Row.of(1, 5), Row.of(2, 300)));

        TableResult result = migrate(spec("flags", 10, true));

        assertThat(result.getStatus()).isEqualTo(TableState.FAILED);
        assertThat(result.getError().getType()).isEqualTo("CoercionException");
        assertThat(result.getError().getMessage()).contains("level").contains("300");
        assertThat(result.getRowsWritten()).isZero();
    }

    @Test
    void changedSourceColumnsFailTheTableAsDrift() {
        source.sequenceTable("users", 5);
        source.overrideCursorColumns("users", List.of("id", "email"));

        TableResult result = migrate(spec("users", 10, true));

        assertThat(result.getStatus()).isEqualTo(TableState.FAILED);
        assertThat(result.getError().getType()).isEqualTo("SchemaDriftException");
        assertThat(result.getError().getFailedState()).isEqualTo(TableState.STREAMING);
        assertThat(destination.insertCalls()).isZero();
    }

    @Test
    void incompatibleExistingTableFailsDuringSync() {
        source.table("users",
            List.of(column("id", "bigint", false), column("email", "varchar(255)", true)),
            List.of("id"),
            List.of(Row.of(1L, "a@example.com")));
        destination.existingTable("users", List.of("id"));

        TableResult result = migrate(spec("users", 10, true));

        assertThat(result.getStatus()).isEqualTo(TableState.FAILED);
        assertThat(result.getError().getType()).isEqualTo("SchemaMismatchException");
        assertThat(result.getError().getMessage()).contains("email");
        assertThat(result.getError().getFailedState()).isEqualTo(TableState.SYNCING);
    }

    @Test
    void brokenCursorFailsTheTableWithoutResuming() {
        source.sequenceTable("logs", 20);
        source.failReadAt("logs", 12, new SQLException("Lost connection to MySQL server during query", "08S01"));

        TableResult result = migrate(spec("logs", 5, true));

        assertThat(result.getStatus()).isEqualTo(TableState.FAILED);
        assertThat(result.getError().getType()).isEqualTo("ReadException");
        assertThat(result.getError().getMessage()).contains("Connection lost");
        assertThat(result.getRowsWritten()).isLessThanOrEqualTo(10);
        assertThat(source.cursorsOpened()).isEqualTo(1);
    }

    @Test
    void transientCursorOpenFailureIsRetried() {
        source.sequenceTable("logs", 8);
        source.failOpenCursor("logs", new SQLTransientConnectionException("Too many connections"));

        TableResult result = migrate(spec("logs", 5, true));

        assertThat(result.getStatus()).isEqualTo(TableState.SUCCEEDED);
        assertThat(source.cursorsOpened()).isEqualTo(1);
    }

    @Test
    void cancelledBeforeStartIsSkipped() {
        source.sequenceTable("users", 10);
        CancellationToken token = new CancellationToken();
        token.cancel();

        TableResult result = migrator(settings).migrate(spec("users", 5, true), token);

        assertThat(result.getStatus()).isEqualTo(TableState.SKIPPED);
        assertThat(destination.ddl()).isEmpty();
    }

    @Test
    void cancellationStopsBetweenWholeBatches() {
        source.sequenceTable("big", 100);
        CancellationToken token = new CancellationToken();
        source.onRow("big", index -> {
            if (index == 50) {
                token.cancel();
            }
        });

        TableResult result = migrator(settings).migrate(spec("big", 10, true), token);

        assertThat(result.getStatus()).isEqualTo(TableState.SKIPPED);
        assertThat(result.getRowsWritten()).isLessThan(100);
        assertThat(result.getRowsWritten() % 10).isZero();
        assertThat(destination.insertSizes("big")).allMatch(size -> size == 10);
    }

    @Test
    void partialBatchIsFlushedAfterTheFlushTimeout() {
        source.sequenceTable("slow", 6);
        source.onRow("slow", index -> {
            if (index == 4) {
                sleep(600);
            }
        });
        EngineSettings slowSource = settings.toBuilder()
            .fetchSize(4)
            .flushTimeout(Duration.ofMillis(50))
            .build();

        TableResult result = migrator(slowSource).migrate(spec("slow", 10, true), new CancellationToken());

        assertThat(result.getStatus()).isEqualTo(TableState.SUCCEEDED);
        assertThat(destination.insertSizes("slow")).containsExactly(4, 2);
    }

    @Test
    void steadyTrickleOfSmallChunksStillFlushesOnTime() {
        source.sequenceTable("trickle", 10);
        source.onRow("trickle", index -> {
            if (index % 2 == 0) {
                sleep(200);
            }
        });
        EngineSettings trickle = settings.toBuilder()
            .fetchSize(2)
            .flushTimeout(Duration.ofMillis(300))
            .build();

        TableResult result = migrator(trickle).migrate(spec("trickle", 10, true), new CancellationToken());

        assertThat(result.getStatus()).isEqualTo(TableState.SUCCEEDED);
        assertThat(result.getRowsWritten()).isEqualTo(10);
        assertThat(destination.insertSizes("trickle")).hasSizeGreaterThan(1).allMatch(size -> size < 10);
    }

    @Test
    void unreachableSourceFailsTheTable() {
        source.sequenceTable("users", 3);
        sessions.sourceUnreachable(new SQLTransientConnectionException("Communications link failure"));

        TableResult result = migrate(spec("users", 5, true));

        assertThat(result.getStatus()).isEqualTo(TableState.FAILED);
        assertThat(result.getError().getType()).isEqualTo("ConnectionException");
        assertThat(result.getError().getFailedState()).isEqualTo(TableState.PENDING);
    }

    @Test
    void sessionsAreClosedWhenTheTableEnds() {
        source.sequenceTable("users", 3);
        source.sequenceTable("broken", 3);
        source.overrideCursorColumns("broken", List.of("x"));

        migrate(spec("users", 5, true));
        migrate(spec("broken", 5, true));

        assertThat(source.closes()).isEqualTo(2);
        assertThat(destination.closes()).isEqualTo(2);
    }

    @Test
    void dropsAndRecreatesWhenConfigured() {
        source.sequenceTable("users", 3);
        destination.existingTable("users", List.of("id"));

        TableResult result = migrator(settings.toBuilder().dropTableBeforeCreate(true).build())
            .migrate(spec("users", 5, true), new CancellationToken());

        assertThat(result.getStatus()).isEqualTo(TableState.SUCCEEDED);
        assertThat(destination.ddl()).containsExactly("drop users", "create users");
    }

    @Test
    void writesIntoTheRenamedDestinationTable() {
        source.sequenceTable("orders", 7);

        TableResult result = migrate(TableSpec.builder()
            .sourceTable("orders").destinationTable("orders_ch").batchSize(5).verify(true).build());

        assertThat(result.getStatus()).isEqualTo(TableState.SUCCEEDED);
        assertThat(destination.rows("orders_ch")).hasSize(7);
        assertThat(destination.rows("orders")).isEmpty();
    }

    @Test
    void retriedInsertMayDuplicateButNeverLoseRows() {
        source.sequenceTable("orders", 20);
        destination.applyBeforeFailing(true);
        destination.failInserts(call -> call == 1 ? new SQLTransientConnectionException("reset after apply") : null);

        TableResult result = migrate(spec("orders", 10, false));

        assertThat(result.getStatus()).isEqualTo(TableState.SUCCEEDED);
        int stored = destination.rows("orders").size();
        assertThat(stored).isGreaterThanOrEqualTo(20).isLessThanOrEqualTo(20 + 10 * settings.getWriteMaxAttempts());
        List<Long> ids = new ArrayList<>();
        destination.rows("orders").forEach(row -> ids.add((Long) row.get(0).getValue()));
        assertThat(ids).contains(1L, 10L, 11L, 20L);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
