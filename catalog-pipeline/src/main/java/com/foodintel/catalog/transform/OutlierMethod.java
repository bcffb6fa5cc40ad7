package com.foodintel.catalog.transform;

import java.util.Locale;

public enum OutlierMethod {
    /** Keep values within [Q1 - t·IQR, Q3 + t·IQR] */
    IQR,
    /** Keep values less than t standard deviations from the mean */
    ZSCORE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
