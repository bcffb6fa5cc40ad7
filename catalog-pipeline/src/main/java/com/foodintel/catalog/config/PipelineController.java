package com.foodintel.catalog.config;

import com.foodintel.catalog.model.PipelineOutcome;
import com.foodintel.catalog.model.PipelineRequest;
import com.foodintel.catalog.service.CatalogPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class PipelineController {

    private final CatalogPipelineService pipelineService;
    private final CatalogPipelineProperties properties;

    /**
     * Start a run on a background thread.
     *
     * POST /pipeline/trigger?category=chocolats&maxItems=50&incremental=true
     */
    @PostMapping("/pipeline/trigger")
    public ResponseEntity<Map<String, String>> trigger(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) Integer maxItems,
            @RequestParam(defaultValue = "false") boolean skipEnrichment,
            @RequestParam(defaultValue = "false") boolean incremental) {

        PipelineRequest request = PipelineRequest.builder()
                .category(category != null ? category : properties.getDefaults().getCategory())
                .maxItems(maxItems != null ? maxItems : properties.getDefaults().getMaxItems())
                .skipEnrichment(skipEnrichment)
                .incremental(incremental)
                .build();
        try {
            CatalogPipelineService.validate(request);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        new Thread(() -> runQuietly(request), "manual-pipeline-" + request.getCategory()).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "category", request.getCategory()));
    }

    @GetMapping("/pipeline/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("service", "food-intel-catalog-pipeline");
        status.put("version", "1.0.0");
        status.put("dataSource", "Open Food Facts / Base Adresse Nationale");
        status.put("outputMode", properties.getOutput().getMode());

        pipelineService.getLastOutcome().ifPresent(last -> status.put("lastRun", describe(last)));
        return ResponseEntity.ok(status);
    }

    private void runQuietly(PipelineRequest request) {
        try {
            pipelineService.run(request);
        } catch (Exception e) {
            log.error("Triggered run for '{}' failed: {}", request.getCategory(), e.getMessage());
        }
    }

    private static Map<String, Object> describe(PipelineOutcome outcome) {
        Map<String, Object> run = new LinkedHashMap<>();
        run.put("runId", outcome.getRunId());
        run.put("category", outcome.getCategory());
        run.put("status", outcome.getStatus());
        run.put("recordsFetched", outcome.getRecordsFetched());
        run.put("recordsNew", outcome.getRecordsNew());
        run.put("recordsWritten", outcome.getRecordsWritten());
        if (outcome.getMetrics() != null) {
            run.put("qualityGrade", outcome.getMetrics().getQualityGrade());
        }
        if (outcome.getOutputLocation() != null) {
            run.put("output", outcome.getOutputLocation());
        }
        return run;
    }
}
