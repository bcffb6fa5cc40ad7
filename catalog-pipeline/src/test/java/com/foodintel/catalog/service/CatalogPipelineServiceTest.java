package com.foodintel.catalog.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodintel.catalog.config.CatalogPipelineProperties;
import com.foodintel.catalog.enrichment.GeocodingEnricher;
import com.foodintel.catalog.exception.PipelineException;
import com.foodintel.catalog.ingest.IdentityStore;
import com.foodintel.catalog.model.GeocodingResult;
import com.foodintel.catalog.model.PipelineOutcome;
import com.foodintel.catalog.model.PipelineRequest;
import com.foodintel.catalog.model.PipelineRun;
import com.foodintel.catalog.model.ProductRecord;
import com.foodintel.catalog.output.PersistenceSink;
import com.foodintel.catalog.output.RawSnapshotWriter;
import com.foodintel.catalog.quality.QualityReportWriter;
import com.foodintel.catalog.quality.QualityScorer;
import com.foodintel.catalog.transform.Dataset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.foodintel.catalog.model.ProductColumns.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class CatalogPipelineServiceTest {

    @Mock
    private CatalogSource catalogSource;
    @Mock
    private QualityReportWriter reportWriter;
    @Mock
    private PersistenceSink sink;

    private final List<String> geocoded = new ArrayList<>();
    private final Set<String> knownCodes = new java.util.HashSet<>();
    private boolean historyLoaded;
    private RecommendationService advisor = summary -> "1. Drop rows without a product name";

    @TempDir
    Path rawDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CatalogPipelineProperties properties = new CatalogPipelineProperties();
    private CatalogPipelineService service;

    @BeforeEach
    public void setUp() {
        properties.getOutput().getRaw().setOutputDir(rawDir.toString());

        GeocodingService geocoder = address -> {
            geocoded.add(address);
            return GeocodingResult.builder()
                    .originalAddress(address)
                    .label(address + ", Paris")
                    .latitude(48.86)
                    .longitude(2.35)
                    .city("Paris")
                    .postalCode("75001")
                    .score(0.9)
                    .valid(true)
                    .build();
        };
        IdentityStore identityStore = category -> {
            historyLoaded = true;
            return knownCodes;
        };

        service = new CatalogPipelineService(catalogSource, identityStore,
                new GeocodingEnricher(geocoder, properties), new QualityScorer(),
                reportWriter, sink, new RawSnapshotWriter(objectMapper, properties),
                summary -> advisor.generate(summary), properties);
    }

    private List<Path> rawSnapshots() throws Exception {
        try (Stream<Path> files = Files.list(rawDir)) {
            return files.collect(Collectors.toList());
        }
    }

    private static ProductRecord product(String code, String stores, Object sugars) {
        return ProductRecord.builder()
                .code(code)
                .productName("Chocolat " + code)
                .brands("Lindt")
                .stores(stores)
                .attributes(sugars == null ? Map.of() : Map.of(SUGARS_100G, sugars))
                .build();
    }

    private static PipelineRequest request(boolean incremental, boolean skipEnrichment) {
        return PipelineRequest.builder()
                .category("chocolats")
                .maxItems(50)
                .incremental(incremental)
                .skipEnrichment(skipEnrichment)
                .build();
    }

    private PipelineRun recordedRun() {
        ArgumentCaptor<PipelineRun> captor = ArgumentCaptor.forClass(PipelineRun.class);
        verify(sink).writePipelineRun(captor.capture());
        return captor.getValue();
    }

    @Test
    public void completedRunGoesThroughEveryStage() {
        when(catalogSource.fetch("chocolats", 50)).thenReturn(List.of(
                product("001", "Carrefour, Auchan", 48.0),
                product("002", "Auchan", null),
                product("001", "Carrefour", 48.0)));
        when(reportWriter.write(any(), eq("chocolats"))).thenReturn(Path.of("report.md"));
        when(sink.write(any(Dataset.class), eq("chocolats"))).thenReturn("out.csv");

        PipelineOutcome outcome = service.run(request(false, false));

        assertEquals(PipelineOutcome.Status.COMPLETED, outcome.getStatus());
        assertEquals(3, outcome.getRecordsFetched());
        assertEquals(2, outcome.getRecordsWritten());
        assertEquals("out.csv", outcome.getOutputLocation());
        assertEquals(Path.of("report.md"), outcome.getReportPath());
        assertEquals(List.of("Carrefour", "Auchan"), geocoded, "one lookup per unique store");
        assertEquals(3, outcome.getEnrichmentStats().getSuccessfullyEnriched());
        assertTrue(outcome.getTransformations().contains("Duplicates removed: 1"));
        assertNotNull(outcome.getMetrics());
        assertFalse(historyLoaded, "history is only read for incremental runs");

        ArgumentCaptor<Dataset> written = ArgumentCaptor.forClass(Dataset.class);
        verify(sink).write(written.capture(), eq("chocolats"));
        Dataset dataset = written.getValue();
        assertEquals("carrefour, auchan", dataset.value(0, STORES));
        assertEquals("Carrefour, Paris", dataset.value(0, STORE_ADDRESS), "first store wins");
        assertEquals(48.0, dataset.value(1, SUGARS_100G), "median of the present values");
        assertEquals(true, dataset.value(1, IS_GEOCODED));

        PipelineRun run = recordedRun();
        assertEquals("SUCCESS", run.getStatus());
        assertEquals(outcome.getRunId(), run.getRunId());
        assertNotNull(run.getCompletedAt());
        assertEquals(outcome.getMetrics().getQualityGrade().name(), run.getQualityGrade());
        assertEquals(service.getLastOutcome().orElseThrow(), outcome);
    }

    @Test
    public void emptyFetchStopsWithNoDataFetched() {
        when(catalogSource.fetch("chocolats", 50)).thenReturn(List.of());

        PipelineOutcome outcome = service.run(request(false, false));

        assertEquals(PipelineOutcome.Status.NO_DATA_FETCHED, outcome.getStatus());
        verify(sink, never()).write(any(), anyString());
        verifyNoInteractions(reportWriter);
        assertEquals("FAILED", recordedRun().getStatus());
    }

    @Test
    public void incrementalRunWithOnlyKnownProductsIsNoNewData() {
        knownCodes.addAll(List.of("001", "002"));
        when(catalogSource.fetch("chocolats", 50)).thenReturn(List.of(
                product("001", "Carrefour", 10), product("002", "Auchan", 20)));

        PipelineOutcome outcome = service.run(request(true, false));

        assertEquals(PipelineOutcome.Status.NO_NEW_DATA, outcome.getStatus());
        assertTrue(historyLoaded);
        assertTrue(geocoded.isEmpty());
        verify(sink, never()).write(any(), anyString());
        assertEquals("SKIPPED", recordedRun().getStatus());
    }

    @Test
    public void incrementalRunKeepsOnlyNewProducts() {
        knownCodes.add("001");
        when(catalogSource.fetch("chocolats", 50)).thenReturn(List.of(
                product("001", "Carrefour", 10), product("002", "Auchan", 20)));
        when(sink.write(any(Dataset.class), eq("chocolats"))).thenReturn("out.csv");

        PipelineOutcome outcome = service.run(request(true, true));

        assertEquals(PipelineOutcome.Status.COMPLETED, outcome.getStatus());
        assertEquals(2, outcome.getRecordsFetched());
        assertEquals(1, outcome.getRecordsNew());
        assertEquals(1, outcome.getRecordsWritten());
    }

    @Test
    public void skippedEnrichmentNeverGeocodes() {
        when(catalogSource.fetch("chocolats", 50)).thenReturn(List.of(product("001", "Carrefour", 10)));
        when(sink.write(any(Dataset.class), eq("chocolats"))).thenReturn("out.csv");

        PipelineOutcome outcome = service.run(request(false, true));

        assertTrue(geocoded.isEmpty());
        assertNull(outcome.getEnrichmentStats());
        ArgumentCaptor<Dataset> written = ArgumentCaptor.forClass(Dataset.class);
        verify(sink).write(written.capture(), eq("chocolats"));
        assertFalse(written.getValue().hasColumn(GEOCODING_SCORE));
    }

    @Test
    public void productsWithoutStoresSkipEnrichment() {
        when(catalogSource.fetch("chocolats", 50)).thenReturn(List.of(product("001", null, 10)));
        when(sink.write(any(Dataset.class), eq("chocolats"))).thenReturn("out.csv");

        PipelineOutcome outcome = service.run(request(false, false));

        assertEquals(PipelineOutcome.Status.COMPLETED, outcome.getStatus());
        assertNull(outcome.getEnrichmentStats());
    }

    @Test
    public void sinkFailureFailsTheRun() {
        when(catalogSource.fetch("chocolats", 50)).thenReturn(List.of(product("001", "Carrefour", 10)));
        when(sink.write(any(Dataset.class), eq("chocolats"))).thenThrow(new IllegalStateException("disk full"));

        PipelineException e = assertThrows(PipelineException.class, () -> service.run(request(false, true)));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        PipelineRun run = recordedRun();
        assertEquals("FAILED", run.getStatus());
        assertEquals("disk full", run.getErrorMessage());
        assertTrue(service.getLastOutcome().isEmpty());
    }

    @Test
    public void invalidRequestsAreRejectedBeforeAnyWork() {
        PipelineRequest badCategory = PipelineRequest.builder().category("../etc").maxItems(5).build();
        PipelineRequest badMax = PipelineRequest.builder().category("chocolats").maxItems(0).build();

        assertThrows(IllegalArgumentException.class, () -> service.run(badCategory));
        assertThrows(IllegalArgumentException.class, () -> service.run(badMax));
        verifyNoInteractions(catalogSource, sink);
    }

    @Test
    public void newProductsAreSnapshotBeforeProcessing() throws Exception {
        knownCodes.add("001");
        when(catalogSource.fetch("chocolats", 50)).thenReturn(List.of(
                product("001", "Carrefour", 10),
                product("002", "Auchan", 20)));
        when(sink.write(any(Dataset.class), eq("chocolats"))).thenReturn("out.csv");

        PipelineOutcome outcome = service.run(request(true, true));

        List<Path> snapshots = rawSnapshots();
        assertEquals(1, snapshots.size());
        assertEquals(snapshots.get(0), outcome.getRawSnapshotPath());
        assertTrue(snapshots.get(0).getFileName().toString().startsWith("chocolats_raw_"));

        JsonNode json = objectMapper.readTree(snapshots.get(0).toFile());
        assertEquals(1, json.size());
        assertEquals("002", json.get(0).get(CODE).asText());
        assertEquals("Auchan", json.get(0).get(STORES).asText(), "snapshot is taken before normalization");
    }

    @Test
    public void noSnapshotWhenNothingIsNewOrWhenDisabled() throws Exception {
        knownCodes.add("001");
        when(catalogSource.fetch("chocolats", 50)).thenReturn(List.of(product("001", "Carrefour", 10)));

        service.run(request(true, true));
        assertTrue(rawSnapshots().isEmpty());

        properties.getOutput().getRaw().setEnabled(false);
        when(catalogSource.fetch("chocolats", 50)).thenReturn(List.of(product("002", "Auchan", 10)));
        when(sink.write(any(Dataset.class), eq("chocolats"))).thenReturn("out.csv");

        PipelineOutcome outcome = service.run(request(true, true));
        assertTrue(rawSnapshots().isEmpty());
        assertNull(outcome.getRawSnapshotPath());
    }

    @Test
    public void transformationSuggestionsOnlyWhenRecommendationsAreEnabled() {
        when(catalogSource.fetch("chocolats", 50)).thenReturn(List.of(product("001", "Carrefour", 10)));
        when(sink.write(any(Dataset.class), eq("chocolats"))).thenReturn("out.csv");

        assertNull(service.run(request(false, true)).getTransformationSuggestions());

        properties.getRecommendations().setEnabled(true);
        assertEquals("1. Drop rows without a product name",
                service.run(request(false, true)).getTransformationSuggestions());

        advisor = summary -> {
            throw new IllegalStateException("connection refused");
        };
        PipelineOutcome outcome = service.run(request(false, true));
        assertEquals(PipelineOutcome.Status.COMPLETED, outcome.getStatus());
        assertTrue(outcome.getTransformationSuggestions().contains("connection refused"));
    }
}
