package com.foodintel.catalog.service;

import com.foodintel.catalog.model.OffProduct;
import com.foodintel.catalog.model.ProductRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.foodintel.catalog.model.ProductColumns.*;

/**
 * Maps raw Open Food Facts products to the pipeline's ProductRecord model.
 */
@Component
@Slf4j
public class ProductRecordMapper {

    /**
     * Convert a raw API product. Nutrition values are passed through untyped;
     * the cleaning chain coerces them to numbers.
     *
     * @return the mapped product, or null when the raw product has no barcode
     */
    public ProductRecord map(OffProduct raw) {
        String code = emptyToNull(raw.getCode());
        if (code == null) {
            log.debug("Skipping product without code: {}", raw.getProductName());
            return null;
        }

        Map<String, Object> nutriments = raw.getNutriments() != null
                ? raw.getNutriments()
                : Collections.emptyMap();

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(NOVA_GROUP, raw.getNovaGroup());
        attributes.put(ENERGY_100G, nutriments.get(ENERGY_100G));
        attributes.put(SUGARS_100G, nutriments.get(SUGARS_100G));
        attributes.put(FAT_100G, nutriments.get(FAT_100G));
        attributes.put(SALT_100G, nutriments.get(SALT_100G));

        return ProductRecord.builder()
                .code(code.trim())
                .productName(emptyToNull(raw.getProductName()))
                .brands(emptyToNull(raw.getBrands()))
                .categories(emptyToNull(raw.getCategories()))
                .stores(emptyToNull(raw.getStores()))
                .nutriscoreGrade(emptyToNull(raw.getNutriscoreGrade()))
                .attributes(Collections.unmodifiableMap(attributes))
                .build();
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }
}
