package com.poc.chmigrator.controller;

import com.poc.chmigrator.model.TableMigrationRecord;
import com.poc.chmigrator.model.TaskRecord;
import com.poc.chmigrator.model.TaskRequest;
import com.poc.chmigrator.service.TaskService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for migration tasks.
 * Exception handling is centralized in GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/task")
@RequiredArgsConstructor
@Slf4j
public class TaskController {

    private final TaskService taskService;

    /**
     * Start a migration task. Returns immediately; tables migrate in the background.
     */
    @PostMapping
    public ResponseEntity<TaskRecord> createTask(@Valid @RequestBody(required = false) TaskRequest request) {
        TaskRequest taskRequest = request != null ? request : new TaskRequest();
        log.info("Received task creation request: {}", taskRequest.getTaskName());

        TaskRecord task = taskService.startTask(taskRequest);

        log.info("Task created with ID: {}", task.getId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(task);
    }

    @GetMapping
    public List<TaskRecord> listTasks() {
        return taskService.listTasks();
    }

    @GetMapping("/{id}")
    public ResponseEntity<TaskRecord> getTask(@PathVariable Long id) {
        log.debug("Getting status for task ID: {}", id);

        return taskService.getTask(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/tables")
    public ResponseEntity<List<TableMigrationRecord>> getTableMigrations(@PathVariable Long id) {
        if (taskService.getTask(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(taskService.getTableMigrations(id));
    }

    /**
     * Request cancellation; the running table stops between batches.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancelTask(@PathVariable Long id) {
        if (taskService.getTask(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (!taskService.cancelTask(id)) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("id", id, "cancelled", false, "message", "Task is not running"));
        }
        return ResponseEntity.accepted().body(Map.of("id", id, "cancelled", true));
    }
}
