package com.poc.chmigrator;

import com.poc.chmigrator.engine.fake.InMemoryDestinationDatabase;
import com.poc.chmigrator.engine.fake.InMemorySessionFactory;
import com.poc.chmigrator.engine.fake.InMemorySourceDatabase;
import com.poc.chmigrator.engine.model.TaskResult;
import com.poc.chmigrator.engine.model.TaskStatus;
import com.poc.chmigrator.engine.port.DatabaseSessionFactory;
import com.poc.chmigrator.model.TableMigrationRecord;
import com.poc.chmigrator.model.TaskRecord;
import com.poc.chmigrator.model.TaskRequest;
import com.poc.chmigrator.service.TaskService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ChMigratorApplicationTest {

    private static final InMemorySourceDatabase SOURCE = new InMemorySourceDatabase()
        .sequenceTable("users", 3)
        .sequenceTable("orders", 1200);
    private static final InMemoryDestinationDatabase DESTINATION = new InMemoryDestinationDatabase();

    @TestConfiguration
    static class InMemoryDatabases {

        @Bean
        @Primary
        DatabaseSessionFactory inMemorySessions() {
            return new InMemorySessionFactory(SOURCE, DESTINATION);
        }
    }

    @Autowired
    private TaskService taskService;

    @Test
    void migratesTheConfiguredTablesAndRecordsHistory() {
        TaskResult result = taskService.runTask(new TaskRequest());

        assertThat(result.getOverallStatus()).isEqualTo(TaskStatus.SUCCEEDED);
        assertThat(result.getTaskName()).isEqualTo("mysql-to-clickhouse");
        assertThat(DESTINATION.rows("users")).hasSize(3);
        assertThat(DESTINATION.insertSizes("orders_ch")).containsExactly(500, 500, 200);

        TaskRecord record = taskService.getTask(result.getTaskId()).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(TaskStatus.SUCCEEDED);
        assertThat(record.getSucceededTables()).isEqualTo(2);
        assertThat(record.getTotalRows()).isEqualTo(1203L);
        assertThat(record.getConfigSnapshot()).contains("source_db").contains("******");

        List<TableMigrationRecord> tables = taskService.getTableMigrations(result.getTaskId());
        assertThat(tables).extracting(TableMigrationRecord::getDestinationTable).containsExactly("users", "orders_ch");
        assertThat(tables.get(0).isVerified()).isTrue();
        assertThat(tables.get(1).isVerified()).isFalse();
    }
}
