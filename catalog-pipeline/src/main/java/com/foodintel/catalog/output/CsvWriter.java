package com.foodintel.catalog.output;

import com.foodintel.catalog.config.CatalogPipelineProperties;
import com.foodintel.catalog.exception.PipelineException;
import com.foodintel.catalog.transform.Dataset;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Writes cleaned datasets to CSV files.
 *
 * Output path pattern: {outputDir}/{category}_{yyyyMMdd_HHmmss}.csv
 * e.g. data/processed/chocolats_20240115_031500.csv
 *
 * The header is the dataset's column order, so code is always the first column.
 * Every file of a category is read back by {@link CsvIdentityStore} for incremental runs.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final CatalogPipelineProperties properties;

    public Path write(Dataset dataset, String category) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        String filename = String.format("%s_%s.csv", category, LocalDateTime.now().format(FILE_TIMESTAMP));
        Path outputPath = outputDir.resolve(filename);

        List<String> columns = dataset.columns();

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(
                     out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(columns.toArray(new String[0]));
            }

            for (Map<String, Object> row : dataset.rows()) {
                writer.writeNext(toRow(row, columns));
            }

            log.info("Written {} records to CSV: {}", dataset.rowCount(), outputPath);

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new PipelineException("CSV write failed", e);
        }
        return outputPath;
    }

    private String[] toRow(Map<String, Object> row, List<String> columns) {
        String[] values = new String[columns.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = str(row.get(columns.get(i)));
        }
        return values;
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new PipelineException("Cannot create output directory: " + dir, e);
        }
    }
}
