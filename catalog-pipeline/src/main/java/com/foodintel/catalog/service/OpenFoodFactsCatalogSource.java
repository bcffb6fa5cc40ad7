package com.foodintel.catalog.service;

import com.foodintel.catalog.config.CatalogPipelineProperties;
import com.foodintel.catalog.exception.PipelineCancelledException;
import com.foodintel.catalog.model.OffProduct;
import com.foodintel.catalog.model.ProductRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pages through Open Food Facts until maxItems products are collected or the
 * category runs out. The thread's interrupt flag is checked between pages.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OpenFoodFactsCatalogSource implements CatalogSource {

    private final OpenFoodFactsClient client;
    private final ProductRecordMapper mapper;
    private final CatalogPipelineProperties properties;

    @Override
    public List<ProductRecord> fetch(String category, int maxItems) {
        // Page size stays fixed across pages: OFF computes the offset as (page - 1) * page_size
        int pageSize = Math.max(1, Math.min(properties.getApi().getPageSize(), maxItems));
        List<ProductRecord> products = new ArrayList<>();
        int skipped = 0;
        int page = 1;

        while (products.size() < maxItems) {
            if (Thread.currentThread().isInterrupted()) {
                throw new PipelineCancelledException(
                        "Fetch of '" + category + "' interrupted after " + products.size() + " products");
            }

            List<OffProduct> batch = client.fetchPage(category, page, pageSize);
            log.info("Page {}: {} products", page, batch.size());

            for (OffProduct raw : batch) {
                if (products.size() >= maxItems) break;
                ProductRecord record = mapper.map(raw);
                if (record == null) {
                    skipped++;
                } else {
                    products.add(record);
                }
            }

            if (batch.size() < pageSize) {
                break;  // last page
            }
            page++;
        }

        log.info("Fetched {} products for category '{}' ({} without code skipped)",
                products.size(), category, skipped);
        return Collections.unmodifiableList(products);
    }
}
