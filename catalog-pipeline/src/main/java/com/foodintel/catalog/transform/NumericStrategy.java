package com.foodintel.catalog.transform;

import java.util.Locale;

/** How missing numeric values are imputed. */
public enum NumericStrategy {
    MEDIAN,
    MEAN,
    ZERO,
    /** Leave numeric gaps untouched */
    NONE;

    /** Case-insensitive; an unrecognized or null name means NONE. */
    public static NumericStrategy fromName(String name) {
        if (name == null) return NONE;
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }
}
