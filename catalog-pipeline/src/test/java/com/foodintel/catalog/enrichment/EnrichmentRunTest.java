package com.foodintel.catalog.enrichment;

import com.foodintel.catalog.model.EnrichmentStats;
import com.foodintel.catalog.model.GeocodingResult;
import com.foodintel.catalog.model.ProductRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class EnrichmentRunTest {

    private static ProductRecord product(String code, String stores) {
        return ProductRecord.builder().code(code).stores(stores).build();
    }

    private static GeocodingResult valid(String address, double score) {
        return GeocodingResult.builder()
                .originalAddress(address)
                .label(address + " label")
                .latitude(45.0)
                .longitude(4.0)
                .city("Lyon")
                .postalCode("69001")
                .score(score)
                .valid(true)
                .build();
    }

    @Test
    public void extractsUniqueCandidatesInFirstSeenOrder() {
        EnrichmentRun run = new EnrichmentRun(new GeocodeCacheTest.RecordingGeocoder(), 100);

        Set<String> addresses = run.extractAddresses(List.of(
                product("1", "Carrefour, Auchan"),
                product("2", " Auchan ,U, ,Lidl"),
                product("3", null)));

        assertEquals(List.of("Carrefour", "Auchan", "Lidl"), List.copyOf(addresses));
    }

    @Test
    public void firstMatchingStoreWinsEvenOverBetterLaterMatch() {
        GeocodeCache cache = GeocodeCache.of(Map.of(
                "Auchan", valid("Auchan", 0.55),
                "Carrefour", valid("Carrefour", 0.95)));
        EnrichmentRun run = new EnrichmentRun(new GeocodeCacheTest.RecordingGeocoder(), 100);

        List<ProductRecord> enriched = run.enrich(List.of(product("1", "Unknown, Auchan, Carrefour")), cache);

        ProductRecord p = enriched.get(0);
        assertEquals("Auchan label", p.getStoreAddress());
        assertEquals(0.55, p.getGeocodingScore());
        assertTrue(p.isGeocoded());
    }

    @Test
    public void invalidFirstMatchStillWins() {
        GeocodeCache cache = GeocodeCache.of(Map.of(
                "Carrefour", valid("Carrefour", 0.9),
                "Auchan", GeocodingResult.invalid("Auchan")));
        EnrichmentRun run = new EnrichmentRun(new GeocodeCacheTest.RecordingGeocoder(), 100);

        ProductRecord p = run.enrich(List.of(product("1", "Auchan, Carrefour")), cache).get(0);

        assertEquals(0.0, p.getGeocodingScore());
        assertNull(p.getLatitude());
        assertEquals(0, run.getStats().getSuccessfullyEnriched());
        assertEquals(1, run.getStats().getFailedEnrichment());
    }

    @Test
    public void countsInvalidHitsAndMissesAsFailures() {
        GeocodeCache cache = GeocodeCache.of(Map.of(
                "Carrefour", valid("Carrefour", 0.9),
                "Nowhere", GeocodingResult.invalid("Nowhere")));
        EnrichmentRun run = new EnrichmentRun(new GeocodeCacheTest.RecordingGeocoder(), 100);
        ProductRecord miss = product("3", "Lidl");

        List<ProductRecord> enriched = run.enrich(List.of(
                product("1", "Carrefour"),
                product("2", "Nowhere"),
                miss,
                product("4", null)), cache);

        assertEquals(4, enriched.size());
        assertSame(miss, enriched.get(2), "products without a hit are passed through unchanged");
        assertTrue(enriched.get(1).isGeocoded(), "an invalid hit is still copied");
        assertEquals(0.0, enriched.get(1).getGeocodingScore());

        EnrichmentStats stats = run.getStats();
        assertEquals(4, stats.getTotalProcessed());
        assertEquals(1, stats.getSuccessfullyEnriched());
        assertEquals(3, stats.getFailedEnrichment());
        assertEquals(25.0, stats.getSuccessRate(), 1e-9);
        assertEquals(2, stats.getCacheSize());
        assertEquals(50.0, stats.getCacheSuccessRate(), 1e-9);
    }

    @Test
    public void inputProductsAreNotModified() {
        ProductRecord original = product("1", "Carrefour");
        EnrichmentRun run = new EnrichmentRun(new GeocodeCacheTest.RecordingGeocoder(), 100);

        run.enrich(List.of(original), GeocodeCache.of(Map.of("Carrefour", valid("Carrefour", 0.9))));

        assertFalse(original.isGeocoded());
        assertNull(original.getLatitude());
    }

    @Test
    public void buildCacheUsesConfiguredLimit() {
        GeocodeCacheTest.RecordingGeocoder geocoder = new GeocodeCacheTest.RecordingGeocoder();
        EnrichmentRun run = new EnrichmentRun(geocoder, 2);

        GeocodeCache cache = run.buildCache(run.extractAddresses(List.of(product("1", "Aaa, Bbb, Ccc"))));

        assertEquals(2, cache.size());
        assertEquals(List.of("Aaa", "Bbb"), geocoder.calls);
    }

    @Test
    public void emptyRunReportsZeroRates() {
        EnrichmentStats stats = new EnrichmentRun(new GeocodeCacheTest.RecordingGeocoder(), 100).getStats();

        assertEquals(0, stats.getTotalProcessed());
        assertEquals(0.0, stats.getSuccessRate());
        assertEquals(0.0, stats.getCacheSuccessRate());
    }
}
