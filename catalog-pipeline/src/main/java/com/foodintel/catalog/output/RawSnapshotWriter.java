package com.foodintel.catalog.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodintel.catalog.config.CatalogPipelineProperties;
import com.foodintel.catalog.exception.PipelineException;
import com.foodintel.catalog.model.ProductRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Backup of the products a run is about to process, taken right after the
 * incremental gate and before any enrichment or cleaning.
 *
 * Output path pattern: {outputDir}/{category}_raw_{yyyyMMdd_HHmmss}.json
 *
 * One JSON object per product, with the same flat keys as the CSV output.
 * Snapshots are never read back by the pipeline.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RawSnapshotWriter {

    private final ObjectMapper objectMapper;
    private final CatalogPipelineProperties properties;

    public Path write(List<ProductRecord> products, String category) {
        Path outputDir = Paths.get(properties.getOutput().getRaw().getOutputDir());
        Path outputPath = outputDir.resolve(String.format("%s_raw_%s.json",
                category, LocalDateTime.now().format(CsvWriter.FILE_TIMESTAMP)));

        List<Map<String, Object>> rows = products.stream()
                .map(ProductRecord::toRow)
                .collect(Collectors.toList());

        try {
            Files.createDirectories(outputDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), rows);
        } catch (IOException e) {
            throw new PipelineException("Cannot write raw snapshot " + outputPath, e);
        }

        log.info("Raw snapshot ({} products): {}", products.size(), outputPath.getFileName());
        return outputPath;
    }
}
