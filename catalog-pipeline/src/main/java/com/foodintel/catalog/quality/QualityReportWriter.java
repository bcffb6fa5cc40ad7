package com.foodintel.catalog.quality;

import com.foodintel.catalog.config.CatalogPipelineProperties;
import com.foodintel.catalog.exception.PipelineException;
import com.foodintel.catalog.model.QualityMetrics;
import com.foodintel.catalog.service.RecommendationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;

/**
 * Writes a Markdown quality report per run.
 *
 * Output path pattern: {outputDir}/{category}_quality_{yyyyMMdd_HHmmss}.md
 *
 * The recommendations section comes from the {@link RecommendationService}. When that
 * service is disabled or fails, a fixed message is written instead; the report itself
 * never fails because of it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class QualityReportWriter {

    static final String FALLBACK_RECOMMENDATIONS =
            "Automatic recommendations are unavailable for this run. "
                    + "Start with the columns at the top of the missing-value table.";

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter DISPLAY_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final RecommendationService recommendationService;
    private final CatalogPipelineProperties properties;

    public Path write(QualityMetrics metrics, String category) {
        LocalDateTime now = LocalDateTime.now();
        String report = render(metrics, recommendations(metrics), now);

        Path outputDir = Paths.get(properties.getReports().getOutputDir());
        Path outputPath = outputDir.resolve(
                String.format("%s_quality_%s.md", category, now.format(FILE_TIMESTAMP)));

        try {
            Files.createDirectories(outputDir);
            Files.writeString(outputPath, report, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PipelineException("Cannot write quality report " + outputPath, e);
        }

        log.info("Quality report written: {}", outputPath);
        return outputPath;
    }

    String recommendations(QualityMetrics metrics) {
        if (!properties.getRecommendations().isEnabled()) {
            log.debug("Recommendations disabled, using fallback text");
            return FALLBACK_RECOMMENDATIONS;
        }
        try {
            String text = recommendationService.generate(summarize(metrics));
            return text == null || text.isBlank() ? FALLBACK_RECOMMENDATIONS : text;
        } catch (Exception e) {
            log.warn("Recommendation service failed, using fallback text: {}", e.getMessage());
            return FALLBACK_RECOMMENDATIONS;
        }
    }

    String summarize(QualityMetrics metrics) {
        return String.format(Locale.ROOT, """
                Data quality analysis of a product dataset:
                - Total: %d records
                - Completeness: %.1f%%
                - Duplicates: %.1f%%
                - Grade: %s

                Null values per column:
                %s
                """,
                metrics.getTotalRecords(),
                metrics.getCompletenessScore() * 100,
                metrics.getDuplicatesPct(),
                metrics.getQualityGrade(),
                metrics.getNullCounts());
    }

    String render(QualityMetrics metrics, String recommendations, LocalDateTime generatedAt) {
        StringBuilder md = new StringBuilder();
        md.append("# Data Quality Report\n\n");
        md.append("**Generated**: ").append(generatedAt.format(DISPLAY_TIMESTAMP)).append("\n\n");

        md.append("## Overall Metrics\n\n");
        md.append("| Metric | Value | Target |\n");
        md.append("|--------|-------|--------|\n");
        md.append(String.format(Locale.ROOT, "| **Grade** | **%s** | A or B |%n", metrics.getQualityGrade()));
        md.append(String.format(Locale.ROOT, "| Total records | %d | - |%n", metrics.getTotalRecords()));
        md.append(String.format(Locale.ROOT, "| Duplicates | %.1f%% | ≤ 5%% |%n", metrics.getDuplicatesPct()));
        md.append(String.format(Locale.ROOT, "| Completeness | %.1f%% | ≥ 70%% |%n", metrics.getCompletenessScore() * 100));
        md.append(String.format(Locale.ROOT, "| Geocoded | %.1f%% | ≥ 50%% |%n", metrics.getGeocodingSuccessRate()));

        md.append("\n## Missing Values\n\n");
        md.append("| Column | Nulls | % Missing |\n");
        md.append("|--------|-------|-----------|\n");
        int total = metrics.getTotalRecords();
        metrics.getNullCounts().entrySet().stream()
                .filter(e -> e.getValue() > 0 && total > 0)
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .forEach(e -> md.append(String.format(Locale.ROOT, "| %s | %d | %.1f%% |%n",
                        e.getKey(), e.getValue(), e.getValue() * 100.0 / total)));

        md.append("\n## Recommendations\n\n");
        md.append(recommendations).append("\n\n");
        md.append("---\n*Generated by the catalog pipeline*\n");
        return md.toString();
    }
}
