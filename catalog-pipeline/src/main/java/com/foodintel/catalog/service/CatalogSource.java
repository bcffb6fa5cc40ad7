package com.foodintel.catalog.service;

import com.foodintel.catalog.model.ProductRecord;

import java.util.List;

/**
 * Product catalog the pipeline ingests from.
 */
public interface CatalogSource {

    /**
     * @param category catalog category, e.g. "chocolats"
     * @param maxItems upper bound on products returned
     * @return products in catalog order; may hold fewer than maxItems, never null
     */
    List<ProductRecord> fetch(String category, int maxItems);
}
