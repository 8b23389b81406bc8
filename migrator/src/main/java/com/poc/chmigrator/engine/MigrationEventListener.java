package com.poc.chmigrator.engine;

import com.poc.chmigrator.engine.model.MigrationTask;
import com.poc.chmigrator.engine.model.TableResult;
import com.poc.chmigrator.engine.model.TaskResult;

/**
 * Receives task lifecycle events from the task runner. Implementations may be
 * called concurrently from several table migrations and must not assume that a
 * thrown exception affects the migration; it is logged and ignored.
 */
public interface MigrationEventListener {

    default void onTaskStarted(MigrationTask task) {
    }

    default void onTableCompleted(MigrationTask task, TableResult result) {
    }

    default void onTaskCompleted(MigrationTask task, TaskResult result) {
    }
}
