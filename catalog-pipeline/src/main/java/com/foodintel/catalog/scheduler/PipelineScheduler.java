package com.foodintel.catalog.scheduler;

import com.foodintel.catalog.config.CatalogPipelineProperties;
import com.foodintel.catalog.model.PipelineRequest;
import com.foodintel.catalog.output.OutputRouter;
import com.foodintel.catalog.service.CatalogPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup runs in service mode.
 *
 * Default schedule: every day at 03:00 UTC, incremental, with the default
 * category. Scheduling is off unless catalog-pipeline.scheduling.enabled=true.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnWebApplication
public class PipelineScheduler {

    private final CatalogPipelineService pipelineService;
    private final OutputRouter outputRouter;
    private final CatalogPipelineProperties properties;

    /**
     * Once the service is up:
     *  1. Ensure the ClickHouse schema exists (when ClickHouse is an output)
     *  2. Optionally run the pipeline if run-on-startup is set
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        outputRouter.ensureSchema();

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("run-on-startup=true, running the pipeline now");
            runDefault();
        } else if (properties.getScheduling().isEnabled()) {
            log.info("Pipeline ready. Schedule: {}", properties.getScheduling().getCron());
        } else {
            log.info("Pipeline ready. Scheduling disabled, use POST /pipeline/trigger");
        }
    }

    @Scheduled(cron = "${catalog-pipeline.scheduling.cron:0 0 3 * * ?}", zone = "UTC")
    public void scheduledRun() {
        if (!properties.getScheduling().isEnabled()) {
            return;
        }
        log.info("Scheduled pipeline run triggered");
        runDefault();
    }

    void runDefault() {
        PipelineRequest request = PipelineRequest.builder()
                .category(properties.getDefaults().getCategory())
                .maxItems(properties.getDefaults().getMaxItems())
                .incremental(properties.getScheduling().isIncremental())
                .build();
        try {
            pipelineService.run(request);
        } catch (Exception e) {
            log.error("Scheduled run failed: {}", e.getMessage(), e);
        }
    }
}
