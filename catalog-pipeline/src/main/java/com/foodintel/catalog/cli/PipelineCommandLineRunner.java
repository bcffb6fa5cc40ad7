package com.foodintel.catalog.cli;

import com.foodintel.catalog.config.CatalogPipelineProperties;
import com.foodintel.catalog.exception.PipelineCancelledException;
import com.foodintel.catalog.model.EnrichmentStats;
import com.foodintel.catalog.model.PipelineOutcome;
import com.foodintel.catalog.model.PipelineRequest;
import com.foodintel.catalog.output.OutputRouter;
import com.foodintel.catalog.service.CatalogPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * One-shot command line entry point.
 *
 * <pre>
 *   --category=chocolats   catalog category to fetch
 *   --max-items=50         upper bound on fetched products
 *   --skip-enrichment      do not geocode stores
 *   --incremental          only keep products not stored by earlier runs
 *   --verbose              DEBUG logging for the pipeline packages
 *   --run                  run with the configured defaults
 * </pre>
 *
 * Exit codes: 0 for a completed run, a run with no new products or a run
 * cancelled by Ctrl-C; 1 when the catalog returned nothing; 2 for any other failure.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_NO_DATA = 1;
    static final int EXIT_FAILURE = 2;

    private static final String BASE_PACKAGE = "com.foodintel.catalog";
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final CatalogPipelineService pipelineService;
    private final OutputRouter outputRouter;
    private final CatalogPipelineProperties properties;
    private final LoggingSystem loggingSystem;

    private int exitCode = EXIT_OK;

    public static boolean isCliInvocation(String[] args) {
        return Arrays.stream(args).anyMatch(a -> a.equals("--run") || a.startsWith("--category"));
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("run") && !args.containsOption("category")) {
            return;
        }
        if (args.containsOption("verbose")) {
            loggingSystem.setLogLevel(BASE_PACKAGE, LogLevel.DEBUG);
        }

        try {
            PipelineRequest request = parse(args);
            outputRouter.ensureSchema();
            PipelineOutcome outcome = runInterruptibly(request);
            exitCode = exitCodeFor(outcome);
            printSummary(outcome);

        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            exitCode = EXIT_FAILURE;
        } catch (PipelineCancelledException e) {
            log.warn("Pipeline interrupted by user");
            exitCode = EXIT_OK;
        } catch (Exception e) {
            log.error("Pipeline failed: {}", e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    /**
     * Ctrl-C does not interrupt this thread by itself. The hook does, so the run is
     * recorded as cancelled and the process exits with {@link #EXIT_OK}.
     */
    private PipelineOutcome runInterruptibly(PipelineRequest request) {
        InterruptOnShutdown hook = InterruptOnShutdown.forCurrentThread(SHUTDOWN_GRACE, EXIT_OK);
        Thread hookThread = new Thread(hook, "pipeline-shutdown");
        Runtime.getRuntime().addShutdownHook(hookThread);
        try {
            return pipelineService.run(request);
        } finally {
            hook.finished();
            try {
                Runtime.getRuntime().removeShutdownHook(hookThread);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, leaving the finished hook registered");
            }
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    PipelineRequest parse(ApplicationArguments args) {
        CatalogPipelineProperties.Defaults defaults = properties.getDefaults();
        String category = single(args, "category", defaults.getCategory());
        String maxItems = single(args, "max-items", String.valueOf(defaults.getMaxItems()));

        int max;
        try {
            max = Integer.parseInt(maxItems.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--max-items must be an integer: " + maxItems);
        }

        return PipelineRequest.builder()
                .category(category.trim())
                .maxItems(max)
                .skipEnrichment(args.containsOption("skip-enrichment"))
                .incremental(args.containsOption("incremental"))
                .build();
    }

    private static String single(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return fallback;
        }
        return values.get(values.size() - 1);
    }

    static int exitCodeFor(PipelineOutcome outcome) {
        return outcome.getStatus() == PipelineOutcome.Status.NO_DATA_FETCHED ? EXIT_NO_DATA : EXIT_OK;
    }

    private void printSummary(PipelineOutcome outcome) {
        log.info("Run {} finished: {}", outcome.getRunId(), outcome.getStatus());
        log.info("  fetched={} new={} written={}",
                outcome.getRecordsFetched(), outcome.getRecordsNew(), outcome.getRecordsWritten());

        if (outcome.getMetrics() != null) {
            log.info("  quality grade: {}", outcome.getMetrics().getQualityGrade());
        }
        EnrichmentStats stats = outcome.getEnrichmentStats();
        if (stats != null) {
            log.info("  geocoded: {}/{} ({}%)",
                    stats.getSuccessfullyEnriched(), stats.getTotalProcessed(), stats.getSuccessRate());
        }
        if (outcome.getReportPath() != null) {
            log.info("  report: {}", outcome.getReportPath());
        }
    }
}
