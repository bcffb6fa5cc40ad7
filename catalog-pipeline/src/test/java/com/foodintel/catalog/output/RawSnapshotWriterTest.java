package com.foodintel.catalog.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodintel.catalog.config.CatalogPipelineProperties;
import com.foodintel.catalog.exception.PipelineException;
import com.foodintel.catalog.model.ProductRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RawSnapshotWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private RawSnapshotWriter writer(Path dir) {
        CatalogPipelineProperties properties = new CatalogPipelineProperties();
        properties.getOutput().getRaw().setOutputDir(dir.toString());
        return new RawSnapshotWriter(objectMapper, properties);
    }

    @Test
    public void writesOneFlatObjectPerProduct() throws Exception {
        ProductRecord product = ProductRecord.builder()
                .code("3017620422003")
                .productName("Nutella")
                .stores("Carrefour")
                .attributes(Map.of("sugars_100g", 56.3))
                .build();

        Path path = writer(tempDir.resolve("raw")).write(List.of(product), "pates-a-tartiner");

        assertTrue(Files.exists(path));
        assertTrue(path.getFileName().toString().matches("pates-a-tartiner_raw_\\d{8}_\\d{6}\\.json"));
        JsonNode json = objectMapper.readTree(path.toFile());
        assertEquals("3017620422003", json.get(0).get("code").asText());
        assertEquals(56.3, json.get(0).get("sugars_100g").asDouble());
        assertFalse(json.get(0).has("geocoding_score"));
    }

    @Test
    public void unwritableDirectoryFailsTheWrite() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");

        assertThrows(PipelineException.class,
                () -> writer(blocker).write(List.of(ProductRecord.builder().code("1").build()), "chocolats"));
    }
}
