package com.foodintel.catalog.enrichment;

import com.foodintel.catalog.model.EnrichmentStats;
import com.foodintel.catalog.model.GeocodingResult;
import com.foodintel.catalog.model.ProductRecord;
import com.foodintel.catalog.service.GeocodingService;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Geocoding enrichment state of a single pipeline run: the cache it built and
 * its running counters. Create one per run through {@link GeocodingEnricher#startRun()};
 * instances are not shared between runs or threads.
 *
 * Matching is first-match-wins: the first store of a product found in the cache
 * is used even when a later store has a valid, higher scoring result.
 */
@Slf4j
public class EnrichmentRun {

    private final GeocodingService geocoder;
    private final int maxAddresses;

    private GeocodeCache cache = GeocodeCache.empty();
    private int totalProcessed;
    private int successfullyEnriched;
    private int failedEnrichment;

    EnrichmentRun(GeocodingService geocoder, int maxAddresses) {
        this.geocoder = geocoder;
        this.maxAddresses = maxAddresses;
    }

    public Set<String> extractAddresses(List<ProductRecord> products) {
        return StoreNames.extractCandidates(products);
    }

    public GeocodeCache buildCache(Set<String> addresses) {
        log.info("Geocoding the first {} of {} unique addresses",
                Math.min(addresses.size(), maxAddresses), addresses.size());
        cache = GeocodeCache.build(addresses, maxAddresses, geocoder);
        return cache;
    }

    /**
     * Copy geocoding data onto the products whose stores hit the cache.
     * Inputs are never modified; enriched products are copies.
     */
    public List<ProductRecord> enrich(List<ProductRecord> products, GeocodeCache geocodeCache) {
        this.cache = geocodeCache;
        List<ProductRecord> enriched = new ArrayList<>(products.size());

        for (ProductRecord product : products) {
            totalProcessed++;
            Optional<GeocodingResult> match = firstMatch(product, geocodeCache);

            if (match.isPresent()) {
                GeocodingResult geo = match.get();
                enriched.add(product.withGeocoding(geo));
                if (geo.isValid()) {
                    successfullyEnriched++;
                } else {
                    failedEnrichment++;
                }
            } else {
                enriched.add(product);
                failedEnrichment++;
            }
        }

        log.info("Enriched {}/{} products", successfullyEnriched, totalProcessed);
        return enriched;
    }

    private Optional<GeocodingResult> firstMatch(ProductRecord product, GeocodeCache geocodeCache) {
        for (String part : StoreNames.split(product.getStores())) {
            Optional<GeocodingResult> hit = geocodeCache.lookup(part);
            if (hit.isPresent()) {
                log.debug("Product {} matched store '{}'", product.getCode(), part);
                return hit;
            }
        }
        return Optional.empty();
    }

    public EnrichmentStats getStats() {
        return EnrichmentStats.builder()
                .totalProcessed(totalProcessed)
                .successfullyEnriched(successfullyEnriched)
                .failedEnrichment(failedEnrichment)
                .successRate(totalProcessed > 0 ? (double) successfullyEnriched / totalProcessed * 100 : 0.0)
                .cacheSize(cache.size())
                .cacheSuccessRate(cache.successRate() * 100)
                .build();
    }
}
