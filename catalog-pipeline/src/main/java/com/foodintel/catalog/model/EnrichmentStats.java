package com.foodintel.catalog.model;

import lombok.Builder;
import lombok.Value;

/**
 * Counters of one enrichment run. successRate and cacheSuccessRate are percentages.
 */
@Value
@Builder
public class EnrichmentStats {
    int totalProcessed;
    int successfullyEnriched;
    int failedEnrichment;
    double successRate;
    int cacheSize;
    double cacheSuccessRate;
}
