package com.foodintel.catalog.output;

import com.foodintel.catalog.config.CatalogPipelineProperties;
import com.foodintel.catalog.config.CatalogPipelineProperties.Output.OutputMode;
import com.foodintel.catalog.model.PipelineRun;
import com.foodintel.catalog.transform.Dataset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class OutputRouterTest {

    @Mock
    private ClickHouseWriter clickHouseWriter;
    @Mock
    private CsvWriter csvWriter;
    @Mock
    private CsvIdentityStore csvIdentityStore;

    private CatalogPipelineProperties properties;
    private OutputRouter router;

    private final Dataset dataset = Dataset.fromRows(List.of(Map.of("code", "1")));

    @BeforeEach
    public void setUp() {
        properties = new CatalogPipelineProperties();
        router = new OutputRouter(clickHouseWriter, csvWriter, csvIdentityStore, properties);
    }

    @Test
    public void csvModeNeverTouchesClickHouse() {
        properties.getOutput().setMode(OutputMode.CSV);
        when(csvWriter.write(dataset, "chocolats")).thenReturn(Path.of("out/chocolats_1.csv"));
        when(csvIdentityStore.loadKnownIds("chocolats")).thenReturn(Set.of("1"));

        assertEquals(Path.of("out/chocolats_1.csv").toString(), router.write(dataset, "chocolats"));
        assertEquals(Set.of("1"), router.loadKnownIds("chocolats"));
        router.writePipelineRun(PipelineRun.builder().runId("r").build());
        router.ensureSchema();

        verifyNoInteractions(clickHouseWriter);
    }

    @Test
    public void bothModeWritesEverywhereAndReadsHistoryFromClickHouse() {
        properties.getOutput().setMode(OutputMode.BOTH);
        when(csvWriter.write(dataset, "chocolats")).thenReturn(Path.of("out.csv"));
        when(clickHouseWriter.loadKnownIds("chocolats")).thenReturn(Set.of("7"));

        assertEquals("out.csv, catalog.products", router.write(dataset, "chocolats"));
        assertEquals(Set.of("7"), router.loadKnownIds("chocolats"));

        verify(clickHouseWriter).write(dataset, "chocolats");
        verifyNoInteractions(csvIdentityStore);
    }

    @Test
    public void clickHouseModeReturnsTableName() {
        properties.getOutput().setMode(OutputMode.CLICKHOUSE);

        assertEquals("catalog.products", router.write(dataset, "chocolats"));
        verifyNoInteractions(csvWriter);
    }

    @Test
    public void schemaFailureIsOnlyLogged() {
        properties.getOutput().setMode(OutputMode.CLICKHOUSE);
        doThrow(new IllegalStateException("no server")).when(clickHouseWriter).ensureSchema();

        assertDoesNotThrow(() -> router.ensureSchema());
    }

    @Test
    public void clickHouseValueRowsEscapeText() {
        ClickHouseWriter writer = new ClickHouseWriter(mock(JdbcTemplate.class));
        Map<String, Object> row = new java.util.HashMap<>();
        row.put("code", "001");
        row.put("product_name", "L'Or\\noir");
        row.put("sugars_100g", 12.5);
        row.put("is_geocoded", true);
        row.put("unstored", "ignored");

        String values = writer.toValueRow(row, "chocolats", LocalDateTime.of(2024, 1, 15, 3, 0));

        assertTrue(values.startsWith("('chocolats','001','L\\'Or\\\\noir',NULL,"));
        assertTrue(values.contains(",12.5,"));
        assertTrue(values.endsWith(",1,'2024-01-15 03:00:00')"));
        assertFalse(values.contains("ignored"));
    }

    @Test
    public void pipelineRunInsertFailureIsSwallowed() {
        JdbcTemplate jdbc = mock(JdbcTemplate.class);
        doThrow(new IllegalStateException("down")).when(jdbc).execute(anyString());
        ClickHouseWriter writer = new ClickHouseWriter(jdbc);

        assertDoesNotThrow(() -> writer.writePipelineRun(PipelineRun.builder()
                .runId("r1").category("chocolats").status("FAILED")
                .startedAt(LocalDateTime.now()).build()));
        verify(jdbc).execute(anyString());
    }

    @Test
    public void emptyDatasetIsNotInserted() {
        JdbcTemplate jdbc = mock(JdbcTemplate.class);

        new ClickHouseWriter(jdbc).write(Dataset.empty(), "chocolats");

        verify(jdbc, never()).execute(any(String.class));
    }
}
