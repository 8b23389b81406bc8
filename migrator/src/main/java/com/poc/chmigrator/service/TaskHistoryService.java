package com.poc.chmigrator.service;

import com.poc.chmigrator.engine.model.TableResult;
import com.poc.chmigrator.engine.model.TaskResult;
import com.poc.chmigrator.engine.model.TaskStatus;
import com.poc.chmigrator.model.TableMigrationRecord;
import com.poc.chmigrator.model.TableMigrationRecordRepository;
import com.poc.chmigrator.model.TaskRecord;
import com.poc.chmigrator.model.TaskRecordRepository;
import com.poc.chmigrator.exception.MigrationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Persists task and table history. Written to by the task lifecycle, read by the
 * REST layer; the engine itself never reads it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskHistoryService {

    private final TaskRecordRepository taskRepository;
    private final TableMigrationRecordRepository tableRepository;

    @Transactional
    public TaskRecord createTask(String taskName, String configSnapshot, int totalTables) {
        TaskRecord record = TaskRecord.builder()
            .taskName(taskName)
            .status(TaskStatus.PENDING)
            .configSnapshot(configSnapshot)
            .totalTables(totalTables)
            .build();
        return taskRepository.save(record);
    }

    @Transactional
    public void markRunning(Long taskId) {
        TaskRecord record = load(taskId);
        record.setStatus(TaskStatus.RUNNING);
        record.setStartedAt(LocalDateTime.now());
        taskRepository.save(record);
        log.info("[Task-{}] Status updated to: {}", taskId, TaskStatus.RUNNING);
    }

    @Transactional
    public void recordTable(Long taskId, TableResult result) {
        TableMigrationRecord.TableMigrationRecordBuilder row = TableMigrationRecord.builder()
            .taskId(taskId)
            .sourceTable(result.getTable().getSourceTable())
            .destinationTable(result.getTable().getDestinationTable())
            .state(result.getStatus())
            .rowsRead(result.getRowsRead())
            .rowsWritten(result.getRowsWritten())
            .batchesWritten(result.getBatchesWritten())
            .sourceCount(result.getSourceCount())
            .destinationCount(result.getDestinationCount())
            .verified(result.isVerified())
            .durationMs(result.getDuration() != null ? result.getDuration().toMillis() : 0)
            .rowsPerSecond(result.rowsPerSecond())
            .skipReason(result.getSkipReason());
        if (result.getError() != null) {
            row.failedState(result.getError().getFailedState())
                .errorMessage(result.getError().summary());
        }
        tableRepository.save(row.build());

        TaskRecord record = load(taskId);
        record.recordTable(result.isSucceeded(), result.isFailed(), result.getRowsWritten());
        taskRepository.save(record);
    }

    @Transactional
    public void completeTask(Long taskId, TaskResult result) {
        TaskRecord record = load(taskId);
        record.setSucceededTables((int) result.succeededCount());
        record.setFailedTables((int) result.failedCount());
        record.setSkippedTables((int) result.skippedCount());
        record.setTotalRows(result.totalRowsWritten());
        record.setLastError(lastError(result));
        record.complete(result.getOverallStatus(), result.getDuration().toMillis());
        taskRepository.save(record);
        log.info("[Task-{}] Status updated to: {}", taskId, result.getOverallStatus());
    }

    /**
     * Records a task that died outside the engine, e.g. a rejected submission.
     */
    @Transactional
    public void failTask(Long taskId, String error) {
        TaskRecord record = load(taskId);
        record.setLastError(error);
        long elapsed = record.getExecutionDuration().toMillis();
        record.complete(TaskStatus.FAILED, elapsed);
        taskRepository.save(record);
        log.info("[Task-{}] Status updated to: {}", taskId, TaskStatus.FAILED);
    }

    @Transactional(readOnly = true)
    public Optional<TaskRecord> findTask(Long taskId) {
        return taskRepository.findById(taskId);
    }

    @Transactional(readOnly = true)
    public List<TaskRecord> recentTasks() {
        return taskRepository.findTop50ByOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public List<TableMigrationRecord> tablesOf(Long taskId) {
        return tableRepository.findByTaskIdOrderByIdAsc(taskId);
    }

    private TaskRecord load(Long taskId) {
        return taskRepository.findById(taskId)
            .orElseThrow(() -> new MigrationException("Task not found: " + taskId));
    }

    private static String lastError(TaskResult result) {
        if (result.getTaskError() != null) {
            return result.getTaskError();
        }
        return result.firstFailure()
            .map(failed -> failed.getTable().getSourceTable() + ": " + failed.getError().summary())
            .orElse(null);
    }
}
