package com.foodintel.catalog.model;

/**
 * Letter grade for a cleaned dataset, derived from a 0-100 weighted score.
 */
public enum QualityGrade {
    A, B, C, D, F;

    /** Lower bounds are inclusive: exactly 90 is an A, 89.999 a B. */
    public static QualityGrade fromScore(double score) {
        if (score >= 90) return A;
        if (score >= 75) return B;
        if (score >= 60) return C;
        if (score >= 40) return D;
        return F;
    }
}
