package com.poc.chmigrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for starting a migration task. Both fields are optional: without
 * them every configured table is migrated under the configured task name.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskRequest {

    @Size(max = 255, message = "Task name must be at most 255 characters")
    private String taskName;

    /**
     * Source table names to migrate, a subset of the configured tables, in the
     * order given.
     */
    private List<String> tables;
}
