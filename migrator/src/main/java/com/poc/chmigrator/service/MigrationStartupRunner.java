package com.poc.chmigrator.service;

import com.poc.chmigrator.engine.model.TaskResult;
import com.poc.chmigrator.model.TaskRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the configured table list once at startup.
 */
@Component
@ConditionalOnProperty(prefix = "migration", name = "run-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class MigrationStartupRunner implements ApplicationRunner {

    private final TaskService taskService;

    @Override
    public void run(ApplicationArguments args) {
        log.info("migration.run-on-startup is set; running configured tables");
        TaskResult result = taskService.runTask(new TaskRequest());
        log.info("Startup migration finished: {} ({} succeeded, {} failed, {} skipped)",
            result.getOverallStatus().getDisplayName(), result.succeededCount(),
            result.failedCount(), result.skippedCount());
    }
}
