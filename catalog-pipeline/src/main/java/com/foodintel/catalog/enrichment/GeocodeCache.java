package com.foodintel.catalog.enrichment;

import com.foodintel.catalog.model.GeocodingResult;
import com.foodintel.catalog.service.GeocodingService;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Store name → geocoding result for one pipeline run.
 *
 * Every cached name was resolved exactly once, including the ones that failed:
 * a failed lookup is kept as an invalid result so the run never asks again.
 */
@Slf4j
public final class GeocodeCache {

    private static final GeocodeCache EMPTY = new GeocodeCache(Map.of());

    private final Map<String, GeocodingResult> entries;

    private GeocodeCache(Map<String, GeocodingResult> entries) {
        this.entries = entries;
    }

    public static GeocodeCache empty() {
        return EMPTY;
    }

    /** Cache over already resolved results, keyed as given. */
    public static GeocodeCache of(Map<String, GeocodingResult> resolved) {
        return new GeocodeCache(Collections.unmodifiableMap(new LinkedHashMap<>(resolved)));
    }

    /**
     * Resolve at most {@code limit} candidates, in the candidates' iteration order.
     * The limit bounds the number of geocoder calls per run; candidates past it
     * are simply not geocoded.
     */
    public static GeocodeCache build(Collection<String> candidates, int limit, GeocodingService geocoder) {
        Map<String, GeocodingResult> entries = new LinkedHashMap<>();

        for (String candidate : candidates) {
            if (entries.size() >= limit) {
                log.info("Address limit of {} reached, {} candidates left unresolved",
                        limit, candidates.size() - limit);
                break;
            }
            entries.computeIfAbsent(candidate, address -> resolve(geocoder, address));
        }

        GeocodeCache cache = new GeocodeCache(Collections.unmodifiableMap(entries));
        log.info("Geocoding success rate: {}% over {} addresses",
                String.format("%.1f", cache.successRate() * 100), cache.size());
        return cache;
    }

    private static GeocodingResult resolve(GeocodingService geocoder, String address) {
        try {
            GeocodingResult result = geocoder.resolve(address);
            return result != null ? result : GeocodingResult.invalid(address);
        } catch (RuntimeException e) {
            log.warn("Geocoding failed for '{}': {}", address, e.getMessage());
            return GeocodingResult.invalid(address);
        }
    }

    public Optional<GeocodingResult> lookup(String address) {
        return Optional.ofNullable(entries.get(address));
    }

    public boolean contains(String address) {
        return entries.containsKey(address);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Fraction of cached results that are valid, 0 for an empty cache. */
    public double successRate() {
        if (entries.isEmpty()) {
            return 0.0;
        }
        long valid = entries.values().stream().filter(GeocodingResult::isValid).count();
        return (double) valid / entries.size();
    }
}
