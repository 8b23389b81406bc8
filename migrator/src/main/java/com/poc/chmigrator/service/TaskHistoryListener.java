package com.poc.chmigrator.service;

import com.poc.chmigrator.engine.MigrationEventListener;
import com.poc.chmigrator.engine.model.MigrationTask;
import com.poc.chmigrator.engine.model.TableResult;
import com.poc.chmigrator.engine.model.TaskResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Mirrors task lifecycle events into the history store. Table events are
 * serialized so concurrent tables do not race on the task's counters.
 */
@Component
@RequiredArgsConstructor
public class TaskHistoryListener implements MigrationEventListener {

    private final TaskHistoryService historyService;

    @Override
    public void onTaskStarted(MigrationTask task) {
        historyService.markRunning(task.getId());
    }

    @Override
    public synchronized void onTableCompleted(MigrationTask task, TableResult result) {
        historyService.recordTable(task.getId(), result);
    }

    @Override
    public synchronized void onTaskCompleted(MigrationTask task, TaskResult result) {
        historyService.completeTask(task.getId(), result);
    }
}
