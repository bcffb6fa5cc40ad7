package com.foodintel.catalog.enrichment;

import com.foodintel.catalog.model.GeocodingResult;
import com.foodintel.catalog.service.GeocodingService;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class GeocodeCacheTest {

    /** Records every call; names starting with "bad" fail, names starting with "boom" throw. */
    static class RecordingGeocoder implements GeocodingService {
        final List<String> calls = new ArrayList<>();

        @Override
        public GeocodingResult resolve(String address) {
            calls.add(address);
            if (address.startsWith("boom")) {
                throw new IllegalStateException("geocoder down");
            }
            if (address.startsWith("bad")) {
                return GeocodingResult.invalid(address);
            }
            return GeocodingResult.builder()
                    .originalAddress(address)
                    .label(address + " HQ")
                    .latitude(48.85)
                    .longitude(2.35)
                    .city("Paris")
                    .postalCode("75001")
                    .score(0.8)
                    .valid(true)
                    .build();
        }
    }

    @Test
    public void resolvesEachCandidateOnce() {
        RecordingGeocoder geocoder = new RecordingGeocoder();

        GeocodeCache cache = GeocodeCache.build(List.of("Carrefour", "Auchan", "Carrefour"), 100, geocoder);

        assertEquals(List.of("Carrefour", "Auchan"), geocoder.calls);
        assertEquals(2, cache.size());
        assertEquals("Carrefour HQ", cache.lookup("Carrefour").orElseThrow().getLabel());
    }

    @Test
    public void limitBoundsGeocoderCallsInCandidateOrder() {
        RecordingGeocoder geocoder = new RecordingGeocoder();
        Set<String> candidates = new LinkedHashSet<>();
        for (int i = 0; i < 150; i++) {
            candidates.add("Store " + i);
        }

        GeocodeCache cache = GeocodeCache.build(candidates, 100, geocoder);

        assertEquals(100, geocoder.calls.size());
        assertEquals(100, cache.size());
        assertTrue(cache.contains("Store 99"));
        assertFalse(cache.contains("Store 100"));
    }

    @Test
    public void failuresAreCachedAsInvalid() {
        RecordingGeocoder geocoder = new RecordingGeocoder();

        GeocodeCache cache = GeocodeCache.build(List.of("Lidl", "bad place", "boom town"), 10, geocoder);

        assertEquals(3, cache.size());
        assertFalse(cache.lookup("bad place").orElseThrow().isValid());
        GeocodingResult thrown = cache.lookup("boom town").orElseThrow();
        assertFalse(thrown.isValid());
        assertEquals(0.0, thrown.getScore());
        assertEquals(1.0 / 3, cache.successRate(), 1e-9);
    }

    @Test
    public void emptyCacheHasZeroSuccessRate() {
        assertEquals(0.0, GeocodeCache.empty().successRate());
        assertTrue(GeocodeCache.of(Map.of()).isEmpty());
        assertTrue(GeocodeCache.empty().lookup("anything").isEmpty());
    }
}
