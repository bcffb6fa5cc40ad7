package com.foodintel.catalog.ingest;

import java.util.Set;

/**
 * Source of product codes already persisted by earlier runs.
 */
public interface IdentityStore {

    /**
     * @param category catalog category the earlier runs were made for
     * @return codes seen before, empty when nothing was stored yet (never null)
     */
    Set<String> loadKnownIds(String category);
}
