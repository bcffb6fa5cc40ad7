package com.foodintel.catalog.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "catalog-pipeline")
@Data
public class CatalogPipelineProperties {

    private Api api = new Api();
    private Geocoding geocoding = new Geocoding();
    private Output output = new Output();
    private Reports reports = new Reports();
    private Recommendations recommendations = new Recommendations();
    private Scheduling scheduling = new Scheduling();
    private Defaults defaults = new Defaults();

    @Data
    public static class Api {
        private String baseUrl = "https://world.openfoodfacts.org";
        private int pageSize = 100;
        private long rateLimitDelayMs = 1000;
    }

    @Data
    public static class Geocoding {
        private String baseUrl = "https://api-adresse.data.gouv.fr";
        /** Upper bound on unique store names resolved per run */
        private int maxAddresses = 100;
        /** Results below this score are cached as invalid */
        private double minScore = 0.5;
        private int timeoutSeconds = 10;
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.CSV;
        private Csv csv = new Csv();
        private Raw raw = new Raw();

        @Data
        public static class Raw {
            /** Snapshot the new products as JSON before enrichment */
            private boolean enabled = true;
            private String outputDir = "data/raw";
        }

        @Data
        public static class Csv {
            private String outputDir = "data/processed";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            CLICKHOUSE, CSV, BOTH
        }
    }

    @Data
    public static class Reports {
        private boolean enabled = true;
        private String outputDir = "data/reports";
    }

    @Data
    public static class Recommendations {
        private boolean enabled = false;
        private String baseUrl = "http://localhost:11434";
        private String model = "llama3.2";
    }

    @Data
    public static class Scheduling {
        private boolean enabled = false;
        private String cron = "0 0 3 * * ?";
        private boolean runOnStartup = false;
        private boolean incremental = true;
    }

    @Data
    public static class Defaults {
        private String category = "chocolats";
        private int maxItems = 50;
    }
}
