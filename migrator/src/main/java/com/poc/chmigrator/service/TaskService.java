package com.poc.chmigrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.chmigrator.config.MigrationProperties;
import com.poc.chmigrator.engine.TaskRunner;
import com.poc.chmigrator.engine.model.CancellationToken;
import com.poc.chmigrator.engine.model.MigrationTask;
import com.poc.chmigrator.engine.model.TableSpec;
import com.poc.chmigrator.engine.model.TaskResult;
import com.poc.chmigrator.exception.MigrationException;
import com.poc.chmigrator.model.TableMigrationRecord;
import com.poc.chmigrator.model.TaskRecord;
import com.poc.chmigrator.model.TaskRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates, runs and cancels migration tasks.
 */
@Service
@Slf4j
public class TaskService {

    private static final String MASK = "******";

    private final TaskRunner taskRunner;
    private final TaskPlanner taskPlanner;
    private final TaskHistoryService historyService;
    private final MigrationProperties properties;
    private final ObjectMapper objectMapper;
    private final TaskExecutor taskExecutor;

    /**
     * Cancellation handles of tasks that have not finished yet.
     */
    private final Map<Long, CancellationToken> activeTasks = new ConcurrentHashMap<>();

    public TaskService(TaskRunner taskRunner, TaskPlanner taskPlanner, TaskHistoryService historyService,
                       MigrationProperties properties, ObjectMapper objectMapper,
                       @Qualifier("migrationTaskExecutor") TaskExecutor taskExecutor) {
        this.taskRunner = taskRunner;
        this.taskPlanner = taskPlanner;
        this.historyService = historyService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.taskExecutor = taskExecutor;
    }

    /**
     * Records a new task and starts it in the background. Returns as soon as the
     * task is queued.
     */
    public TaskRecord startTask(TaskRequest request) {
        MigrationTask task = prepare(request);
        try {
            taskExecutor.execute(() -> execute(task));
        } catch (TaskRejectedException e) {
            activeTasks.remove(task.getId());
            historyService.failTask(task.getId(), "Rejected: too many tasks running");
            throw new MigrationException("Cannot start task " + task.getName() + ": executor is saturated", e);
        }
        return historyService.findTask(task.getId()).orElseThrow();
    }

    /**
     * Records a new task and runs it on the calling thread.
     */
    public TaskResult runTask(TaskRequest request) {
        return execute(prepare(request));
    }

    /**
     * Requests cooperative cancellation. Returns false when the task is not running.
     */
    public boolean cancelTask(Long taskId) {
        CancellationToken token = activeTasks.get(taskId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("[Task-{}] Cancellation requested", taskId);
        return true;
    }

    public Optional<TaskRecord> getTask(Long taskId) {
        return historyService.findTask(taskId);
    }

    public List<TaskRecord> listTasks() {
        return historyService.recentTasks();
    }

    public List<TableMigrationRecord> getTableMigrations(Long taskId) {
        return historyService.tablesOf(taskId);
    }

    private MigrationTask prepare(TaskRequest request) {
        String name = request != null && request.getTaskName() != null && !request.getTaskName().isBlank()
            ? request.getTaskName()
            : properties.getTaskName();
        List<TableSpec> tables = taskPlanner.plan(request != null ? request.getTables() : null);

        log.info("Creating task: {} ({} table(s))", name, tables.size());
        TaskRecord record = historyService.createTask(name, configSnapshot(tables), tables.size());

        MigrationTask task = MigrationTask.builder()
            .id(record.getId())
            .name(name)
            .tables(tables)
            .build();
        activeTasks.put(task.getId(), task.getCancellation());
        return task;
    }

    private TaskResult execute(MigrationTask task) {
        try {
            return taskRunner.run(task);
        } finally {
            activeTasks.remove(task.getId());
        }
    }

    /**
     * JSON view of the effective configuration with credentials masked.
     */
    String configSnapshot(List<TableSpec> tables) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("source", endpoint(properties.getSource()));
        snapshot.put("destination", endpoint(properties.getDestination()));
        snapshot.put("tables", tables);
        snapshot.put("skipEmptyTables", properties.isSkipEmptyTables());
        snapshot.put("dropTableBeforeCreate", properties.isDropTableBeforeCreate());
        snapshot.put("performance", properties.getPerformance());
        snapshot.put("retry", properties.getRetry());
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new MigrationException("Failed to serialize configuration snapshot", e);
        }
    }

    private static Map<String, Object> endpoint(MigrationProperties.Endpoint endpoint) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("host", endpoint.getHost());
        view.put("port", endpoint.getPort());
        view.put("database", endpoint.getDatabase());
        view.put("user", endpoint.getUser());
        view.put("password", MASK);
        view.put("charset", endpoint.getCharset());
        return view;
    }
}
