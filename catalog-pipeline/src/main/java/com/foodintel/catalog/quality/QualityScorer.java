package com.foodintel.catalog.quality;

import com.foodintel.catalog.model.QualityGrade;
import com.foodintel.catalog.model.QualityMetrics;
import com.foodintel.catalog.transform.Dataset;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.foodintel.catalog.model.ProductColumns.CODE;
import static com.foodintel.catalog.model.ProductColumns.GEOCODING_SCORE;

/**
 * Scores a cleaned dataset for completeness, duplication and geocoding coverage.
 *
 * Grade formula (0-100 points):
 *  - completeness: up to 40, completeness × 40
 *  - duplicates:   30 at ≤ 1%, 20 at ≤ 5%, 10 at ≤ 10%, else 0
 *  - geocoding:    up to 30 scaled from the success rate; a flat 30 for datasets
 *                  without a geocoding_score column, which are not penalised
 * Letter: ≥ 90 A, ≥ 75 B, ≥ 60 C, ≥ 40 D, else F.
 */
@Component
public class QualityScorer {

    public QualityMetrics analyze(Dataset dataset) {
        double completeness = completeness(dataset);

        int duplicates = countDuplicates(dataset);
        int total = dataset.rowCount();
        double duplicatesPct = total > 0 ? (double) duplicates / total * 100 : 0.0;

        boolean hasGeocoding = dataset.hasColumn(GEOCODING_SCORE);
        double[] geo = geocodingStats(dataset);

        QualityGrade grade = determineGrade(completeness, duplicatesPct, geo[0], hasGeocoding);

        return QualityMetrics.builder()
                .totalRecords(total)
                .validRecords(total - duplicates)
                .completenessScore(round(completeness, 3))
                .duplicatesCount(duplicates)
                .duplicatesPct(round(duplicatesPct, 2))
                .geocodingSuccessRate(round(geo[0], 2))
                .avgGeocodingScore(round(geo[1], 3))
                .nullCounts(nullCounts(dataset))
                .qualityGrade(grade)
                .build();
    }

    /** Share of non-null cells, 0 for a dataset without cells. */
    public double completeness(Dataset dataset) {
        long cells = dataset.cellCount();
        if (cells == 0) return 0.0;

        long nulls = 0;
        for (String column : dataset.columns()) {
            nulls += dataset.nullCount(column);
        }
        return (double) (cells - nulls) / cells;
    }

    /** Rows repeating an earlier row's code (or first column when there is no code). */
    public int countDuplicates(Dataset dataset) {
        if (dataset.columnCount() == 0) return 0;
        String idColumn = dataset.hasColumn(CODE) ? CODE : dataset.columns().get(0);

        Set<Object> seen = new HashSet<>();
        int duplicates = 0;
        for (Object id : dataset.values(idColumn)) {
            if (!seen.add(id)) duplicates++;
        }
        return duplicates;
    }

    /**
     * @return {success rate in percent, average score of the successful rows};
     *         both 0 without a geocoding_score column
     */
    double[] geocodingStats(Dataset dataset) {
        if (!dataset.hasColumn(GEOCODING_SCORE) || dataset.isEmpty()) {
            return new double[]{0.0, 0.0};
        }

        int valid = 0;
        double sum = 0;
        for (Object value : dataset.values(GEOCODING_SCORE)) {
            if (value instanceof Number n && n.doubleValue() > 0) {
                valid++;
                sum += n.doubleValue();
            }
        }
        double rate = (double) valid / dataset.rowCount() * 100;
        double avg = valid > 0 ? sum / valid : 0.0;
        return new double[]{rate, avg};
    }

    Map<String, Integer> nullCounts(Dataset dataset) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String column : dataset.columns()) {
            counts.put(column, dataset.nullCount(column));
        }
        return Collections.unmodifiableMap(counts);
    }

    // ── Grading ──────────────────────────────────────────────────────────────

    /**
     * @param completeness          fraction in [0, 1]
     * @param duplicatesPct         percent
     * @param geocodingRatePct      percent
     * @param hasGeocodingColumn    whether the dataset carries geocoding scores at all
     */
    public static double score(double completeness, double duplicatesPct,
                               double geocodingRatePct, boolean hasGeocodingColumn) {
        double score = Math.min(completeness * 40, 40);

        if (duplicatesPct <= 1) {
            score += 30;
        } else if (duplicatesPct <= 5) {
            score += 20;
        } else if (duplicatesPct <= 10) {
            score += 10;
        }

        score += hasGeocodingColumn ? Math.min(geocodingRatePct / 100 * 30, 30) : 30;
        return score;
    }

    public static QualityGrade determineGrade(double completeness, double duplicatesPct,
                                              double geocodingRatePct, boolean hasGeocodingColumn) {
        return QualityGrade.fromScore(score(completeness, duplicatesPct, geocodingRatePct, hasGeocodingColumn));
    }

    private static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }
}
