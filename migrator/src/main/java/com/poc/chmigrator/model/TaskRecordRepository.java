package com.poc.chmigrator.model;

import com.poc.chmigrator.engine.model.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface TaskRecordRepository extends JpaRepository<TaskRecord, Long> {

    /**
     * Most recent tasks first, capped at 50.
     */
    List<TaskRecord> findTop50ByOrderByCreatedAtDesc();

    List<TaskRecord> findByStatusIn(Collection<TaskStatus> statuses);

    long countByStatus(TaskStatus status);
}
