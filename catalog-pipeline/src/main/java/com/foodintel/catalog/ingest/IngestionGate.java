package com.foodintel.catalog.ingest;

import com.foodintel.catalog.model.ProductRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Drops products whose code was persisted by an earlier run.
 *
 * The catalog API cannot filter by code, so every page is fetched in full and
 * the known products are skipped here, after the fetch.
 */
@Slf4j
public final class IngestionGate {

    private IngestionGate() {
    }

    /**
     * @param fetched products in catalog order
     * @param known   codes from earlier runs; empty disables filtering
     * @return unknown products in their original order
     */
    public static Result filter(List<ProductRecord> fetched, IdentitySet known) {
        if (known.isEmpty()) {
            return new Result(fetched, 0);
        }

        List<ProductRecord> fresh = fetched.stream()
                .filter(p -> !known.contains(p.getCode()))
                .collect(Collectors.toUnmodifiableList());

        int skipped = fetched.size() - fresh.size();
        if (skipped > 0) {
            log.info("{} already known products skipped", skipped);
        }
        return new Result(fresh, skipped);
    }

    public record Result(List<ProductRecord> records, int skipped) {

        /** Everything fetched was already known. This is a success, not an error. */
        public boolean noNewData() {
            return records.isEmpty() && skipped > 0;
        }
    }
}
