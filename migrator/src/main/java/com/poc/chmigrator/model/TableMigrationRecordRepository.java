package com.poc.chmigrator.model;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TableMigrationRecordRepository extends JpaRepository<TableMigrationRecord, Long> {

    List<TableMigrationRecord> findByTaskIdOrderByIdAsc(Long taskId);
}
