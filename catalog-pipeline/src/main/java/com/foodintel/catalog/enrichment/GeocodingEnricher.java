package com.foodintel.catalog.enrichment;

import com.foodintel.catalog.config.CatalogPipelineProperties;
import com.foodintel.catalog.service.GeocodingService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Hands out a fresh {@link EnrichmentRun} per pipeline run, so counters and the
 * cache never leak from one run into the next.
 */
@Component
@RequiredArgsConstructor
public class GeocodingEnricher {

    private final GeocodingService geocodingService;
    private final CatalogPipelineProperties properties;

    public EnrichmentRun startRun() {
        return new EnrichmentRun(geocodingService, properties.getGeocoding().getMaxAddresses());
    }
}
