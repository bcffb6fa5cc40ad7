package com.foodintel.catalog.enrichment;

import com.foodintel.catalog.model.ProductRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parsing of the free-text stores field, e.g. "Carrefour, Auchan, Lidl".
 */
public final class StoreNames {

    /** Tokens this short are abbreviations or noise, never geocodable store names */
    static final int MIN_TOKEN_LENGTH = 3;

    private StoreNames() {
    }

    /**
     * Ordered, trimmed parts of a stores field. Empty parts are kept out, short ones are not:
     * the enricher matches parts against the cache, which never holds short tokens anyway.
     */
    public static List<String> split(String stores) {
        List<String> parts = new ArrayList<>();
        if (stores == null || stores.isBlank()) {
            return parts;
        }
        for (String part : stores.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    /**
     * Unique candidate addresses over all products, in first-seen order.
     */
    public static Set<String> extractCandidates(Collection<ProductRecord> products) {
        Set<String> candidates = new LinkedHashSet<>();
        for (ProductRecord product : products) {
            for (String part : split(product.getStores())) {
                if (part.length() >= MIN_TOKEN_LENGTH) {
                    candidates.add(part);
                }
            }
        }
        return candidates;
    }
}
