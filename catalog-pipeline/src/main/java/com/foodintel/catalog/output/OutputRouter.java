package com.foodintel.catalog.output;

import com.foodintel.catalog.config.CatalogPipelineProperties;
import com.foodintel.catalog.config.CatalogPipelineProperties.Output.OutputMode;
import com.foodintel.catalog.ingest.IdentityStore;
import com.foodintel.catalog.model.PipelineRun;
import com.foodintel.catalog.transform.Dataset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Routes output to the appropriate sink(s) based on configuration.
 * Supports CLICKHOUSE, CSV, or BOTH modes.
 *
 * Known product codes are read from the sink that holds the full history:
 * ClickHouse when it is written to, the CSV directory otherwise.
 */
@Primary
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter implements PersistenceSink, IdentityStore {

    private final ClickHouseWriter clickHouseWriter;
    private final CsvWriter csvWriter;
    private final CsvIdentityStore csvIdentityStore;
    private final CatalogPipelineProperties properties;

    @Override
    public String write(Dataset dataset, String category) {
        OutputMode mode = properties.getOutput().getMode();

        switch (mode) {
            case CLICKHOUSE -> {
                clickHouseWriter.write(dataset, category);
                return ClickHouseWriter.PRODUCTS_TABLE;
            }
            case CSV -> {
                return csvWriter.write(dataset, category).toString();
            }
            case BOTH -> {
                clickHouseWriter.write(dataset, category);
                return csvWriter.write(dataset, category) + ", " + ClickHouseWriter.PRODUCTS_TABLE;
            }
            default -> throw new IllegalStateException("Unknown output mode: " + mode);
        }
    }

    /** Create the ClickHouse tables when ClickHouse is written to. Failure is logged, not thrown. */
    public void ensureSchema() {
        if (properties.getOutput().getMode() == OutputMode.CSV) {
            return;
        }
        try {
            clickHouseWriter.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise ClickHouse schema: {}", e.getMessage());
        }
    }

    @Override
    public Set<String> loadKnownIds(String category) {
        if (properties.getOutput().getMode() == OutputMode.CSV) {
            return csvIdentityStore.loadKnownIds(category);
        }
        return clickHouseWriter.loadKnownIds(category);
    }

    @Override
    public void writePipelineRun(PipelineRun run) {
        try {
            if (properties.getOutput().getMode() != OutputMode.CSV) {
                clickHouseWriter.writePipelineRun(run);
            }
        } catch (Exception e) {
            log.warn("Failed to write pipeline run metadata: {}", e.getMessage());
        }
    }
}
