package com.foodintel.catalog.output;

import com.foodintel.catalog.config.CatalogPipelineProperties;
import com.foodintel.catalog.ingest.IdentityStore;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Set;

import static com.foodintel.catalog.model.ProductColumns.CODE;

/**
 * Collects the product codes of every CSV written for a category.
 * Files that cannot be read are logged and skipped; they never fail the run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvIdentityStore implements IdentityStore {

    private final CatalogPipelineProperties properties;

    @Override
    public Set<String> loadKnownIds(String category) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        Set<String> ids = new HashSet<>();
        if (!Files.isDirectory(outputDir)) {
            return ids;
        }

        int files = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputDir, category + "_*.csv")) {
            for (Path file : stream) {
                files++;
                readCodes(file, ids);
            }
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", outputDir, e.getMessage());
        }

        log.info("History check: {} files, {} known products", files, ids.size());
        return ids;
    }

    private void readCodes(Path file, Set<String> ids) {
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {

            int codeIndex = 0;
            if (properties.getOutput().getCsv().isIncludeHeader()) {
                String[] header = reader.readNext();
                if (header == null) return;
                codeIndex = indexOf(header, CODE);
                if (codeIndex < 0) {
                    log.warn("No '{}' column in {}, skipped", CODE, file.getFileName());
                    return;
                }
            }

            String[] line;
            while ((line = reader.readNext()) != null) {
                if (codeIndex < line.length && !line[codeIndex].isBlank()) {
                    ids.add(line[codeIndex].trim());
                }
            }
        } catch (IOException | CsvValidationException e) {
            log.warn("Cannot read {}: {}", file.getFileName(), e.getMessage());
        }
    }

    private int indexOf(String[] header, String column) {
        for (int i = 0; i < header.length; i++) {
            if (column.equals(header[i].trim())) return i;
        }
        return -1;
    }
}
