package com.foodintel.catalog.model;

import lombok.Builder;
import lombok.Value;

/** Parameters of one pipeline run, as given on the command line or REST trigger. */
@Value
@Builder
public class PipelineRequest {
    String category;
    int maxItems;
    boolean skipEnrichment;
    boolean incremental;
}
