package com.foodintel.catalog.transform;

/**
 * Logical type of a dataset column. Only NUMERIC and TEXT columns take part in
 * missing-value imputation; CATEGORY and BOOLEAN columns are derived and never imputed.
 */
public enum ColumnType {
    NUMERIC,
    TEXT,
    BOOLEAN,
    CATEGORY;

    /**
     * Infer a type from observed values: all numbers → NUMERIC, all booleans → BOOLEAN,
     * anything else, including a column with no values at all, → TEXT.
     */
    static ColumnType infer(Iterable<?> values) {
        boolean sawValue = false;
        boolean allNumbers = true;
        boolean allBooleans = true;

        for (Object value : values) {
            if (value == null) continue;
            sawValue = true;
            allNumbers &= value instanceof Number;
            allBooleans &= value instanceof Boolean;
        }

        if (!sawValue) return TEXT;
        if (allNumbers) return NUMERIC;
        if (allBooleans) return BOOLEAN;
        return TEXT;
    }
}
