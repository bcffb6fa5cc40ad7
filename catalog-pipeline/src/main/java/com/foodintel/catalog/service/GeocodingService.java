package com.foodintel.catalog.service;

import com.foodintel.catalog.model.GeocodingResult;

/**
 * Resolves a free-text store or place name to coordinates.
 */
public interface GeocodingService {

    /**
     * Never throws for a failed lookup: failures come back as an invalid result
     * with score 0 so callers can cache them.
     */
    GeocodingResult resolve(String address);
}
