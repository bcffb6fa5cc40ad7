package com.foodintel.catalog.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each pipeline run for observability.
 * Stored in the pipeline_runs table in ClickHouse.
 */
@Data
@Builder
public class PipelineRun {

    private String runId;           // UUID
    private String category;
    private boolean incremental;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | SKIPPED | FAILED | CANCELLED
    private int recordsFetched;
    private int recordsNew;
    private int recordsWritten;
    private String qualityGrade;    // null unless scored
    private String errorMessage;    // null on success
}
