package com.foodintel.catalog.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Descriptive statistics over the non-null values of a numeric column.
 * Quantiles use linear interpolation between closest ranks; the standard deviation
 * is the sample one (n - 1).
 */
final class ColumnStats {

    private final List<Double> sorted;

    private ColumnStats(List<Double> sorted) {
        this.sorted = sorted;
    }

    static ColumnStats of(List<Object> values) {
        List<Double> numbers = new ArrayList<>();
        for (Object value : values) {
            if (value instanceof Number n && !Double.isNaN(n.doubleValue())) {
                numbers.add(n.doubleValue());
            }
        }
        Collections.sort(numbers);
        return new ColumnStats(numbers);
    }

    boolean isEmpty() {
        return sorted.isEmpty();
    }

    int count() {
        return sorted.size();
    }

    double mean() {
        double sum = 0;
        for (double v : sorted) sum += v;
        return sorted.isEmpty() ? Double.NaN : sum / sorted.size();
    }

    double median() {
        return quantile(0.5);
    }

    double quantile(double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double pos = (sorted.size() - 1) * q;
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        double low = sorted.get(lo);
        return low + (sorted.get(hi) - low) * (pos - lo);
    }

    /** Sample standard deviation, NaN with fewer than two values. */
    double stdDev() {
        int n = sorted.size();
        if (n < 2) return Double.NaN;
        double mean = mean();
        double squares = 0;
        for (double v : sorted) squares += (v - mean) * (v - mean);
        return Math.sqrt(squares / (n - 1));
    }
}
