package com.foodintel.catalog.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * What a pipeline run produced. Only COMPLETED outcomes carry metrics and an output location.
 */
@Value
@Builder
public class PipelineOutcome {

    public enum Status {
        /** Data fetched, cleaned, scored and persisted */
        COMPLETED,
        /** Incremental run where every fetched product was already known */
        NO_NEW_DATA,
        /** The catalog returned nothing; the run stopped before any processing */
        NO_DATA_FETCHED
    }

    String runId;
    Status status;
    String category;
    int recordsFetched;
    int recordsNew;
    int recordsWritten;
    QualityMetrics metrics;
    EnrichmentStats enrichmentStats;
    List<String> transformations;
    /** Advisor answer on further cleaning; null unless recommendations are enabled */
    String transformationSuggestions;
    String outputLocation;
    Path reportPath;
    Path rawSnapshotPath;
    Duration duration;
}
