package com.foodintel.catalog.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.foodintel.catalog.model.ProductColumns.*;

/**
 * One catalog product flowing through the pipeline.
 *
 * Schema design notes:
 *  - code is the catalog barcode and the identity used for incremental skips
 *  - attributes carries every passthrough catalog field (nutrition facts, grades)
 *    exactly as delivered; values may be numbers or text until the cleaning chain
 *    coerces them
 *  - the geocoding fields stay null until the enricher matches one of the stores
 *
 * Instances are immutable. Stages that change a product produce a copy.
 */
@Value
@Builder(toBuilder = true)
public class ProductRecord {

    // ── Identity and catalog text ────────────────────────────────────────────
    /** Barcode from the catalog, unique per product */
    String code;

    String productName;
    String brands;
    String categories;

    /** Comma-separated store names, e.g. "Carrefour, Auchan" */
    String stores;

    String nutriscoreGrade;

    /** Passthrough attributes in catalog order */
    @Builder.Default
    Map<String, Object> attributes = Collections.emptyMap();

    // ── Geocoding enrichment ─────────────────────────────────────────────────
    String storeAddress;
    Double latitude;
    Double longitude;
    String city;
    String postalCode;
    Double geocodingScore;

    /**
     * True when the enricher copied a geocoding result onto this product,
     * whether or not that result was valid.
     */
    public boolean isGeocoded() {
        return geocodingScore != null;
    }

    /** Copy of this product carrying the given geocoding result. */
    public ProductRecord withGeocoding(GeocodingResult geo) {
        return toBuilder()
                .storeAddress(geo.getLabel())
                .latitude(geo.getLatitude())
                .longitude(geo.getLongitude())
                .city(geo.getCity())
                .postalCode(geo.getPostalCode())
                .geocodingScore(geo.getScore())
                .build();
    }

    public Object attribute(String name) {
        return attributes.get(name);
    }

    /**
     * Flatten into an ordered column → value row. Geocoding columns are only
     * present on products that went through a cache hit.
     */
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(CODE, code);
        row.put(PRODUCT_NAME, productName);
        row.put(BRANDS, brands);
        row.put(CATEGORIES, categories);
        row.put(STORES, stores);
        row.put(NUTRISCORE_GRADE, nutriscoreGrade);
        attributes.forEach(row::putIfAbsent);

        if (isGeocoded()) {
            row.put(STORE_ADDRESS, storeAddress);
            row.put(LATITUDE, latitude);
            row.put(LONGITUDE, longitude);
            row.put(CITY, city);
            row.put(POSTAL_CODE, postalCode);
            row.put(GEOCODING_SCORE, geocodingScore);
        }
        return row;
    }
}
