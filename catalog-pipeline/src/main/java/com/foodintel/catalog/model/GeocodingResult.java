package com.foodintel.catalog.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of resolving one store name against the geocoder.
 * Failed lookups are represented too (valid=false, score 0) so they can be cached.
 */
@Value
@Builder
public class GeocodingResult {

    /** The store token exactly as it was extracted, used as the cache key */
    String originalAddress;

    /** Full address label returned by the geocoder */
    String label;

    Double latitude;
    Double longitude;
    String city;
    String postalCode;

    /** Geocoder confidence in [0, 1] */
    double score;

    /** A usable coordinate came back with enough confidence */
    boolean valid;

    public static GeocodingResult invalid(String address) {
        return GeocodingResult.builder()
                .originalAddress(address)
                .score(0.0)
                .valid(false)
                .build();
    }
}
