package com.foodintel.catalog.service;

import com.foodintel.catalog.config.CatalogPipelineProperties;
import com.foodintel.catalog.model.OffProduct;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Collections;
import java.util.List;

/**
 * Thin client over the Open Food Facts search API.
 *
 * Rate limiting: OFF asks clients to stay below ~10 search requests per minute,
 * so a configurable delay is applied before every call (default 1 second).
 * A 429 or 5xx triggers the Resilience4j retry with exponential backoff.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OpenFoodFactsClient {

    static final String FIELDS =
            "code,product_name,brands,categories,stores,nutriscore_grade,nova_group,nutriments";

    private final RestTemplate restTemplate;
    private final CatalogPipelineProperties properties;

    /**
     * Fetch one page of products tagged with the given category.
     *
     * @param category OFF category tag, e.g. "chocolats"
     * @param page     1-based page number
     * @param pageSize products per page
     * @return products of that page (may be empty, never null)
     */
    @Retry(name = "catalogApi")
    public List<OffProduct> fetchPage(String category, int page, int pageSize) {
        String url = UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getBaseUrl() + "/cgi/search.pl")
                .queryParam("action", "process")
                .queryParam("tagtype_0", "categories")
                .queryParam("tag_contains_0", "contains")
                .queryParam("tag_0", category)
                .queryParam("page", page)
                .queryParam("page_size", pageSize)
                .queryParam("fields", FIELDS)
                .queryParam("json", 1)
                .toUriString();

        return callApi(url);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<OffProduct> callApi(String url) {
        log.debug("Calling Open Food Facts: {}", url);
        try {
            applyRateLimit();
            OffProduct.SearchPage response = restTemplate.getForObject(url, OffProduct.SearchPage.class);
            if (response == null || response.getProducts() == null) {
                return Collections.emptyList();
            }
            log.debug("API returned {} products for URL: {}", response.getProducts().size(), url);
            return response.getProducts();

        } catch (HttpClientErrorException.NotFound e) {
            // 404 on a page past the end, treat as empty
            log.debug("No data found (404) for URL: {}", url);
            return Collections.emptyList();

        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) by Open Food Facts, backing off");
            sleepMs(5000);
            throw e; // let Resilience4j retry

        } catch (Exception e) {
            log.error("API call failed for URL {}: {}", url, e.getMessage());
            throw e;
        }
    }

    private void applyRateLimit() {
        sleepMs(properties.getApi().getRateLimitDelayMs());
    }

    private void sleepMs(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
