package com.poc.chmigrator.model;

import com.poc.chmigrator.engine.model.TableState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Append-only history row written when a table reaches a terminal state.
 */
@Entity
@Table(name = "table_migrations", indexes = {
    @Index(name = "idx_table_migration_task", columnList = "taskId")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TableMigrationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long taskId;

    @Column(nullable = false, length = 64)
    private String sourceTable;

    @Column(nullable = false, length = 64)
    private String destinationTable;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TableState state;

    private long rowsRead;

    private long rowsWritten;

    private int batchesWritten;

    /**
     * -1 when never measured.
     */
    private long sourceCount;

    private long destinationCount;

    private boolean verified;

    private long durationMs;

    private double rowsPerSecond;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private TableState failedState;

    @Lob
    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Column(length = 500)
    private String skipReason;

    @Column(nullable = false, updatable = false)
    private LocalDateTime recordedAt;

    @PrePersist
    protected void onCreate() {
        if (recordedAt == null) {
            recordedAt = LocalDateTime.now();
        }
    }
}
