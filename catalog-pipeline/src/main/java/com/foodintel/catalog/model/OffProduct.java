package com.foodintel.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Raw DTO matching one product of the Open Food Facts search JSON.
 * Kept separate from the domain model to isolate API coupling.
 *
 * nova_group and the nutriments arrive as numbers or strings depending on
 * who edited the product, so they are kept untyped here.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OffProduct {

    private String code;

    @JsonProperty("product_name")
    private String productName;

    private String brands;

    private String categories;

    private String stores;

    @JsonProperty("nutriscore_grade")
    private String nutriscoreGrade;

    @JsonProperty("nova_group")
    private Object novaGroup;

    private Map<String, Object> nutriments;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchPage {
        private Integer count;
        private Integer page;

        @JsonProperty("page_size")
        private Integer pageSize;

        private List<OffProduct> products;
    }
}
