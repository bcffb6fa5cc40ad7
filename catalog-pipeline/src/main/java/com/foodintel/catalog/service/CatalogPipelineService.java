package com.foodintel.catalog.service;

import com.foodintel.catalog.config.CatalogPipelineProperties;
import com.foodintel.catalog.enrichment.EnrichmentRun;
import com.foodintel.catalog.enrichment.GeocodeCache;
import com.foodintel.catalog.enrichment.GeocodingEnricher;
import com.foodintel.catalog.exception.PipelineCancelledException;
import com.foodintel.catalog.exception.PipelineException;
import com.foodintel.catalog.ingest.IdentitySet;
import com.foodintel.catalog.ingest.IdentityStore;
import com.foodintel.catalog.ingest.IngestionGate;
import com.foodintel.catalog.model.EnrichmentStats;
import com.foodintel.catalog.model.PipelineOutcome;
import com.foodintel.catalog.model.PipelineRequest;
import com.foodintel.catalog.model.PipelineRun;
import com.foodintel.catalog.model.ProductRecord;
import com.foodintel.catalog.model.QualityMetrics;
import com.foodintel.catalog.output.PersistenceSink;
import com.foodintel.catalog.output.RawSnapshotWriter;
import com.foodintel.catalog.quality.QualityReportWriter;
import com.foodintel.catalog.quality.QualityScorer;
import com.foodintel.catalog.transform.Dataset;
import com.foodintel.catalog.transform.NumericStrategy;
import com.foodintel.catalog.transform.TransformChain;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

import static com.foodintel.catalog.model.ProductColumns.*;

/**
 * Orchestrates one pipeline run, stage after stage:
 *
 *  0. load known codes (incremental runs only)
 *  1. fetch the category from the catalog, drop the known products and
 *     snapshot the rest as raw JSON
 *  2. geocode the stores and enrich the products (unless skipped)
 *  3. clean the table
 *  4. score its quality and write the report
 *  5. persist the cleaned table
 *
 * Persistence is the last stage, so a run failing anywhere before it leaves
 * no partial dataset behind. Every run is recorded as a PipelineRun.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CatalogPipelineService {

    private static final Pattern CATEGORY_PATTERN = Pattern.compile("[\\p{L}0-9_-]+");
    private static final List<String> NORMALIZED_TEXT_COLUMNS = List.of(BRANDS, CATEGORIES, STORES);

    private final CatalogSource catalogSource;
    private final IdentityStore identityStore;
    private final GeocodingEnricher geocodingEnricher;
    private final QualityScorer qualityScorer;
    private final QualityReportWriter reportWriter;
    private final PersistenceSink persistenceSink;
    private final RawSnapshotWriter rawSnapshotWriter;
    private final RecommendationService recommendationService;
    private final CatalogPipelineProperties properties;

    private final AtomicReference<PipelineOutcome> lastOutcome = new AtomicReference<>();

    /**
     * Run the pipeline once.
     *
     * @throws IllegalArgumentException    for an invalid category or item bound
     * @throws PipelineCancelledException  when the thread was interrupted
     * @throws PipelineException           for any other failure
     */
    public PipelineOutcome run(PipelineRequest request) {
        validate(request);
        String category = request.getCategory();
        Instant start = Instant.now();

        PipelineRun run = PipelineRun.builder()
                .runId(UUID.randomUUID().toString())
                .category(category)
                .incremental(request.isIncremental())
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();

        log.info("============================================================");
        log.info("PIPELINE - category: {}", category.toUpperCase(Locale.ROOT));
        if (request.isIncremental()) {
            log.info("Incremental mode: ON");
        }
        log.info("============================================================");

        try {
            PipelineOutcome outcome = execute(request, run, start);
            lastOutcome.set(outcome);
            return outcome;

        } catch (PipelineCancelledException e) {
            log.warn("Pipeline cancelled: {}", e.getMessage());
            run.setStatus("CANCELLED");
            run.setErrorMessage(e.getMessage());
            throw e;
        } catch (PipelineException e) {
            log.error("Pipeline failed for '{}': {}", category, e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Pipeline failed for '{}': {}", category, e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
            throw new PipelineException("Pipeline run " + run.getRunId() + " for '" + category + "' failed", e);
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            persistenceSink.writePipelineRun(run);
        }
    }

    public Optional<PipelineOutcome> getLastOutcome() {
        return Optional.ofNullable(lastOutcome.get());
    }

    // ── Stages ───────────────────────────────────────────────────────────────

    private PipelineOutcome execute(PipelineRequest request, PipelineRun run, Instant start) {
        String category = request.getCategory();

        // 0. History
        IdentitySet known = IdentitySet.empty();
        if (request.isIncremental()) {
            known = IdentitySet.load(identityStore, category);
            if (!known.isEmpty()) {
                log.info("{} products already stored", known.size());
            }
        }

        // 1. Acquisition
        log.info("STEP 1: fetching products from the catalog");
        List<ProductRecord> fetched = catalogSource.fetch(category, request.getMaxItems());
        run.setRecordsFetched(fetched.size());

        if (fetched.isEmpty()) {
            log.error("No products fetched for '{}'", category);
            run.setStatus("FAILED");
            run.setErrorMessage("No data fetched");
            return outcome(run, PipelineOutcome.Status.NO_DATA_FETCHED, start).build();
        }

        IngestionGate.Result gate = IngestionGate.filter(fetched, known);
        List<ProductRecord> products = gate.records();
        run.setRecordsNew(products.size());

        if (gate.noNewData()) {
            log.info("No new products to process. Pipeline finished.");
            run.setStatus("SKIPPED");
            return outcome(run, PipelineOutcome.Status.NO_NEW_DATA, start).build();
        }

        Path rawSnapshotPath = null;
        if (properties.getOutput().getRaw().isEnabled()) {
            rawSnapshotPath = rawSnapshotWriter.write(products, category);
        }
        checkpoint("enrichment");

        // 2. Enrichment
        EnrichmentStats enrichmentStats = null;
        if (!request.isSkipEnrichment()) {
            log.info("STEP 2: geocoding enrichment");
            EnrichmentRun enrichment = geocodingEnricher.startRun();
            Set<String> addresses = enrichment.extractAddresses(products);

            if (addresses.isEmpty()) {
                log.warn("No addresses found in the '{}' field, enrichment skipped", STORES);
            } else {
                GeocodeCache cache = enrichment.buildCache(addresses);
                products = enrichment.enrich(products, cache);
                enrichmentStats = enrichment.getStats();
            }
        } else {
            log.info("STEP 2: enrichment skipped");
        }
        checkpoint("transformation");

        // 3. Transformation
        log.info("STEP 3: transformation and cleaning");
        TransformChain chain = TransformChain.of(products);
        Dataset clean = chain
                .removeDuplicates(List.of(CODE))
                .handleMissingValues(NumericStrategy.MEDIAN, "unknown")
                .normalizeTextColumns(NORMALIZED_TEXT_COLUMNS)
                .addDerivedColumns()
                .getResult();
        log.info("   Transformations applied: {}", chain.getTransformations().size());
        log.debug("Transformations:\n{}", chain.getSummary());

        String suggestions = null;
        if (properties.getRecommendations().isEnabled()) {
            suggestions = chain.suggestTransformations(recommendationService);
            log.info("   Suggested transformations:\n{}", suggestions);
        }
        checkpoint("quality scoring");

        // 4. Quality
        log.info("STEP 4: quality analysis");
        QualityMetrics metrics = qualityScorer.analyze(clean);
        run.setQualityGrade(metrics.getQualityGrade().name());
        log.info("   Grade: {}", metrics.getQualityGrade());
        log.info("   Completeness: {}%", String.format(Locale.ROOT, "%.1f", metrics.getCompletenessScore() * 100));

        Path reportPath = null;
        if (properties.getReports().isEnabled()) {
            reportPath = reportWriter.write(metrics, category);
        }
        checkpoint("storage");

        // 5. Storage
        log.info("STEP 5: storing the cleaned dataset");
        String location = persistenceSink.write(clean, category);
        run.setRecordsWritten(clean.rowCount());
        run.setStatus("SUCCESS");

        PipelineOutcome outcome = outcome(run, PipelineOutcome.Status.COMPLETED, start)
                .metrics(metrics)
                .enrichmentStats(enrichmentStats)
                .transformations(chain.getTransformations())
                .outputLocation(location)
                .reportPath(reportPath)
                .rawSnapshotPath(rawSnapshotPath)
                .transformationSuggestions(suggestions)
                .build();

        log.info("============================================================");
        log.info("PIPELINE COMPLETED");
        log.info("============================================================");
        log.info("Duration: {} seconds", outcome.getDuration().toSeconds());
        log.info("New products: {}", clean.rowCount());
        log.info("Output: {}", location);
        return outcome;
    }

    private PipelineOutcome.PipelineOutcomeBuilder outcome(PipelineRun run, PipelineOutcome.Status status,
                                                           Instant start) {
        return PipelineOutcome.builder()
                .runId(run.getRunId())
                .status(status)
                .category(run.getCategory())
                .recordsFetched(run.getRecordsFetched())
                .recordsNew(run.getRecordsNew())
                .recordsWritten(run.getRecordsWritten())
                .transformations(List.of())
                .duration(Duration.between(start, Instant.now()));
    }

    /** Stages are not interruptible themselves; cancellation is honoured between them. */
    private void checkpoint(String nextStage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new PipelineCancelledException("Interrupted before " + nextStage);
        }
    }

    public static void validate(PipelineRequest request) {
        if (request.getCategory() == null || !CATEGORY_PATTERN.matcher(request.getCategory()).matches()) {
            throw new IllegalArgumentException(
                    "category must be letters, digits, '-' or '_': " + request.getCategory());
        }
        if (request.getMaxItems() <= 0) {
            throw new IllegalArgumentException("maxItems must be positive: " + request.getMaxItems());
        }
    }
}
