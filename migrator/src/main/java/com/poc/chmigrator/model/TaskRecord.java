package com.poc.chmigrator.model;

import com.poc.chmigrator.engine.model.TaskStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * History row for one migration task run.
 */
@Entity
@Table(name = "migration_tasks", indexes = {
    @Index(name = "idx_task_name", columnList = "taskName"),
    @Index(name = "idx_task_status", columnList = "status"),
    @Index(name = "idx_task_created_at", columnList = "createdAt")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Not unique; the same table list may be migrated many times.
     */
    @Column(nullable = false, length = 255)
    private String taskName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private TaskStatus status;

    /**
     * Effective configuration at start, passwords masked.
     */
    @Lob
    @Column(columnDefinition = "TEXT")
    private String configSnapshot;

    @Lob
    @Column(columnDefinition = "TEXT")
    private String lastError;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private Long executionTimeMs;

    @Builder.Default
    private Integer totalTables = 0;

    @Builder.Default
    private Integer succeededTables = 0;

    @Builder.Default
    private Integer failedTables = 0;

    @Builder.Default
    private Integer skippedTables = 0;

    @Builder.Default
    private Long totalRows = 0L;

    /**
     * Tables that reached a terminal state, as a percentage of the task.
     */
    @Transient
    public Integer getProgressPercentage() {
        if (totalTables == null || totalTables == 0) {
            return 0;
        }
        int done = succeededTables + failedTables + skippedTables;
        return (int) ((done * 100.0) / totalTables);
    }

    @Transient
    public Duration getExecutionDuration() {
        if (executionTimeMs != null) {
            return Duration.ofMillis(executionTimeMs);
        }
        if (startedAt != null) {
            return Duration.between(startedAt, completedAt != null ? completedAt : LocalDateTime.now());
        }
        return Duration.ZERO;
    }

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
        if (status == null) {
            status = TaskStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Mark the task finished with a terminal status.
     */
    public void complete(TaskStatus terminalStatus, long durationMs) {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Status must be terminal: " + terminalStatus);
        }
        this.status = terminalStatus;
        this.completedAt = LocalDateTime.now();
        this.executionTimeMs = durationMs;
    }

    /**
     * Count one finished table.
     */
    public void recordTable(boolean succeeded, boolean failed, long rowsWritten) {
        if (succeeded) {
            succeededTables++;
        } else if (failed) {
            failedTables++;
        } else {
            skippedTables++;
        }
        totalRows += rowsWritten;
    }
}
