package com.foodintel.catalog.transform;

import com.foodintel.catalog.model.ProductRecord;
import com.foodintel.catalog.service.RecommendationService;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.foodintel.catalog.model.ProductColumns.*;

/**
 * Ordered cleaning of a product dataset with an audit log of what was applied.
 *
 * <p>The chain owns its working dataset exclusively: it starts from the dataset it
 * was given and replaces its snapshot after every operation, so datasets handed
 * in or out are never changed afterwards. Operations return the chain itself:
 *
 * <pre>{@code
 * Dataset clean = new TransformChain(raw)
 *         .removeDuplicates(List.of("code"))
 *         .handleMissingValues(NumericStrategy.MEDIAN, "unknown")
 *         .normalizeTextColumns(List.of("brands", "categories", "stores"))
 *         .addDerivedColumns()
 *         .getResult();
 * }</pre>
 *
 * <p>Ordering between operations is the caller's responsibility. In particular
 * text normalization belongs after missing-value handling. There is no undo.
 *
 * <p>Operations referring to absent columns skip them instead of failing.
 */
@Slf4j
public class TransformChain {

    static final double GEOCODED_MIN_SCORE = 0.5;
    static final String SUGGESTIONS_UNAVAILABLE = "Transformation suggestions unavailable: ";

    private Dataset current;
    private final List<String> transformations = new ArrayList<>();

    public TransformChain(Dataset input) {
        this.current = input;
    }

    public static TransformChain of(List<ProductRecord> records) {
        return new TransformChain(Dataset.fromRecords(records));
    }

    // ── Deduplication ────────────────────────────────────────────────────────

    /** Deduplicate on {@code code}, or on the first column when there is no code column. */
    public TransformChain removeDuplicates() {
        return removeDuplicates(null);
    }

    /**
     * Drop rows repeating the values of {@code keyColumns}, keeping the first occurrence.
     */
    public TransformChain removeDuplicates(List<String> keyColumns) {
        List<String> keys = resolveKeyColumns(keyColumns);
        if (keys.isEmpty()) {
            log.debug("removeDuplicates: no key column available, skipped");
            return this;
        }

        int before = current.rowCount();
        Set<List<Object>> seen = new HashSet<>();
        current = current.filterRows(row -> seen.add(keyOf(row, keys)));

        int removed = before - current.rowCount();
        if (removed > 0) {
            record("Duplicates removed: " + removed);
        }
        return this;
    }

    private List<String> resolveKeyColumns(List<String> requested) {
        if (requested == null || requested.isEmpty()) {
            if (current.hasColumn(CODE)) return List.of(CODE);
            List<String> columns = current.columns();
            return columns.isEmpty() ? List.of() : List.of(columns.get(0));
        }
        return requested.stream().filter(current::hasColumn).collect(Collectors.toList());
    }

    private static List<Object> keyOf(Map<String, Object> row, List<String> keys) {
        Object[] key = new Object[keys.size()];
        for (int i = 0; i < key.length; i++) {
            key[i] = row.get(keys.get(i));
        }
        return Arrays.asList(key);
    }

    // ── Missing values ───────────────────────────────────────────────────────

    public TransformChain handleMissingValues() {
        return handleMissingValues(NumericStrategy.MEDIAN, "unknown");
    }

    public TransformChain handleMissingValues(String numericStrategy, String textPlaceholder) {
        return handleMissingValues(NumericStrategy.fromName(numericStrategy), textPlaceholder);
    }

    /**
     * Coerce the known nutrition and score columns to numbers, then impute gaps:
     * numeric columns by {@code numericStrategy}, text columns with {@code textPlaceholder}.
     *
     * <p>Coercion has to come first: a nutrition column delivered as text would
     * otherwise be typed TEXT and get the placeholder instead of a number.
     */
    public TransformChain handleMissingValues(NumericStrategy numericStrategy, String textPlaceholder) {
        coerceNumericTargets();

        for (String column : current.columnsOfType(ColumnType.NUMERIC)) {
            int nulls = current.nullCount(column);
            if (nulls == 0) continue;

            Double fill = fillValue(column, numericStrategy);
            if (fill == null) continue;

            current = current.mapColumn(column, ColumnType.NUMERIC, v -> v == null ? fill : v);
            record(String.format(Locale.ROOT, "%s: %d nulls → %.2f", column, nulls, fill));
        }

        for (String column : current.columnsOfType(ColumnType.TEXT)) {
            int nulls = current.nullCount(column);
            if (nulls == 0) continue;

            current = current.mapColumn(column, ColumnType.TEXT, v -> v == null ? textPlaceholder : v);
            record(String.format("%s: %d nulls → '%s'", column, nulls, textPlaceholder));
        }
        return this;
    }

    private void coerceNumericTargets() {
        for (String column : NUMERIC_TARGETS) {
            if (current.hasColumn(column)) {
                current = current.mapColumn(column, ColumnType.NUMERIC, TransformChain::toNumber);
            }
        }
    }

    /** @return the imputation value, or null when the column must stay untouched */
    private Double fillValue(String column, NumericStrategy strategy) {
        ColumnStats stats = ColumnStats.of(current.values(column));
        switch (strategy) {
            case MEDIAN:
                return stats.isEmpty() ? null : stats.median();
            case MEAN:
                return stats.isEmpty() ? null : stats.mean();
            case ZERO:
                return 0.0;
            default:
                return null;
        }
    }

    /** Finite numbers pass through as doubles, numeric text is parsed, anything else becomes null. */
    static Double toNumber(Object value) {
        if (value == null) return null;
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        String text = value.toString().trim();
        if (text.isEmpty()) return null;
        try {
            double d = Double.parseDouble(text);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // ── Text ─────────────────────────────────────────────────────────────────

    /** Normalize every TEXT column. */
    public TransformChain normalizeTextColumns() {
        return normalizeTextColumns(null);
    }

    /**
     * Trim and lowercase the given columns. Non-text values are rendered as text first
     * and the column becomes TEXT. Null cells stay null.
     */
    public TransformChain normalizeTextColumns(List<String> columns) {
        List<String> targets = columns != null ? columns : current.columnsOfType(ColumnType.TEXT);

        for (String column : targets) {
            if (current.hasColumn(column)) {
                current = current.mapColumn(column, ColumnType.TEXT,
                        v -> v == null ? null : String.valueOf(v).strip().toLowerCase(Locale.ROOT));
            }
        }

        record("Text normalized: " + targets);
        return this;
    }

    // ── Outliers ─────────────────────────────────────────────────────────────

    /**
     * Remove rows whose value in any of {@code columns} is an outlier. Columns are
     * processed in order, each on the rows kept by the previous one. Non-numeric or
     * absent columns are skipped. Within a filtered column a null cell is never
     * inside the bounds, so its row is dropped too.
     */
    public TransformChain filterOutliers(List<String> columns, OutlierMethod method, double threshold) {
        int before = current.rowCount();

        for (String column : columns) {
            if (current.type(column) != ColumnType.NUMERIC) {
                log.debug("filterOutliers: '{}' is absent or not numeric, skipped", column);
                continue;
            }

            ColumnStats stats = ColumnStats.of(current.values(column));
            if (stats.isEmpty()) continue;

            if (method == OutlierMethod.IQR) {
                double q1 = stats.quantile(0.25);
                double q3 = stats.quantile(0.75);
                double iqr = q3 - q1;
                double lower = q1 - threshold * iqr;
                double upper = q3 + threshold * iqr;
                current = current.filterRows(row -> {
                    Object v = row.get(column);
                    if (!(v instanceof Number n)) return false;
                    return n.doubleValue() >= lower && n.doubleValue() <= upper;
                });
            } else {
                double mean = stats.mean();
                double std = stats.stdDev();
                if (!(std > 0)) continue;
                current = current.filterRows(row -> {
                    Object v = row.get(column);
                    if (!(v instanceof Number n)) return false;
                    return Math.abs((n.doubleValue() - mean) / std) < threshold;
                });
            }
        }

        int removed = before - current.rowCount();
        if (removed > 0) {
            record("Outliers filtered (" + method.label() + "): " + removed);
        }
        return this;
    }

    // ── Derived columns ──────────────────────────────────────────────────────

    /**
     * Add {@code sugar_category} from {@code sugars_100g} and {@code is_geocoded} from
     * {@code geocoding_score}, each only when its source column exists.
     */
    public TransformChain addDerivedColumns() {
        if (current.hasColumn(SUGARS_100G)) {
            current = current.mapColumn(SUGARS_100G, ColumnType.NUMERIC, TransformChain::toNumber);
            current = current.withColumn(SUGAR_CATEGORY, ColumnType.CATEGORY,
                    row -> sugarCategory((Double) row.get(SUGARS_100G)));
            record("Added: " + SUGAR_CATEGORY);
        }

        if (current.hasColumn(GEOCODING_SCORE)) {
            current = current.withColumn(IS_GEOCODED, ColumnType.BOOLEAN, row -> {
                Double score = toNumber(row.get(GEOCODING_SCORE));
                return score != null && score >= GEOCODED_MIN_SCORE;
            });
            record("Added: " + IS_GEOCODED);
        }
        return this;
    }

    /** Bins (-∞,5], (5,15], (15,30], (30,∞) */
    static String sugarCategory(Double sugars) {
        if (sugars == null) return null;
        if (sugars <= 5) return "low";
        if (sugars <= 15) return "moderate";
        if (sugars <= 30) return "high";
        return "very_high";
    }

    // ── Suggestions ──────────────────────────────────────────────────────────

    /**
     * Ask {@code advisor} which further cleaning steps this dataset needs, given its
     * shape and the transformations already applied. Never fails: when the advisor
     * throws or answers nothing, the returned text says so.
     */
    public String suggestTransformations(RecommendationService advisor) {
        try {
            String answer = advisor.generate(describeForSuggestions());
            return answer == null || answer.isBlank() ? SUGGESTIONS_UNAVAILABLE + "empty answer" : answer;
        } catch (Exception e) {
            log.warn("Transformation suggestions failed: {}", e.getMessage());
            return SUGGESTIONS_UNAVAILABLE + e.getMessage();
        }
    }

    String describeForSuggestions() {
        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (String column : current.columns()) {
            types.put(column, current.type(column));
        }
        return String.format(Locale.ROOT, """
                Product dataset with %d rows.
                Columns: %s
                Types: %s

                Transformations already applied:
                %s

                Which additional cleaning transformations do you recommend?
                """, current.rowCount(), current.columns(), types, getSummary());
    }

    // ── Results ──────────────────────────────────────────────────────────────

    /** The current snapshot. Later operations do not change a returned dataset. */
    public Dataset getResult() {
        return current;
    }

    public List<String> getTransformations() {
        return List.copyOf(transformations);
    }

    public String getSummary() {
        if (transformations.isEmpty()) {
            return "No transformations applied.";
        }
        return transformations.stream().map(t -> "• " + t).collect(Collectors.joining("\n"));
    }

    private void record(String entry) {
        transformations.add(entry);
        log.debug("Transformation: {}", entry);
    }
}
