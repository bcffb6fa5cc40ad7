package com.foodintel.catalog.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Quality snapshot of one cleaned dataset. Built once per run and never updated.
 *
 * Percentages (duplicatesPct, geocodingSuccessRate) are on a 0-100 scale,
 * completenessScore is a fraction in [0, 1].
 */
@Value
@Builder
public class QualityMetrics {

    int totalRecords;
    int validRecords;
    double completenessScore;
    int duplicatesCount;
    double duplicatesPct;
    double geocodingSuccessRate;
    double avgGeocodingScore;

    /** Null cells per column, in dataset column order */
    Map<String, Integer> nullCounts;

    QualityGrade qualityGrade;
}
