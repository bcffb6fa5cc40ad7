package com.foodintel.catalog.model;

import java.util.List;

/**
 * Column names shared by the record model, the cleaning chain, the quality scorer
 * and the output sinks. The dashboard reads the persisted table by these names,
 * so they must stay stable.
 */
public final class ProductColumns {

    // ── Catalog ──────────────────────────────────────────────────────────────
    public static final String CODE = "code";
    public static final String PRODUCT_NAME = "product_name";
    public static final String BRANDS = "brands";
    public static final String CATEGORIES = "categories";
    public static final String STORES = "stores";
    public static final String NUTRISCORE_GRADE = "nutriscore_grade";
    public static final String NOVA_GROUP = "nova_group";
    public static final String ENERGY_100G = "energy_100g";
    public static final String SUGARS_100G = "sugars_100g";
    public static final String FAT_100G = "fat_100g";
    public static final String SALT_100G = "salt_100g";

    // ── Geocoding enrichment ─────────────────────────────────────────────────
    public static final String STORE_ADDRESS = "store_address";
    public static final String LATITUDE = "latitude";
    public static final String LONGITUDE = "longitude";
    public static final String CITY = "city";
    public static final String POSTAL_CODE = "postal_code";
    public static final String GEOCODING_SCORE = "geocoding_score";

    // ── Derived ──────────────────────────────────────────────────────────────
    public static final String SUGAR_CATEGORY = "sugar_category";
    public static final String IS_GEOCODED = "is_geocoded";

    /** Columns that must hold numbers even when the catalog sends them as text. */
    public static final List<String> NUMERIC_TARGETS = List.of(
            ENERGY_100G, SUGARS_100G, FAT_100G, SALT_100G, NOVA_GROUP, GEOCODING_SCORE);

    private ProductColumns() {
    }
}
