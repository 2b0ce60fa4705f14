package com.warehouseanalytics.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.warehouseanalytics.common.exception.InvalidArgumentException;

/**
 * Anomaly detection sensitivity. Each level carries the number of standard
 * deviations a point must stray from its rolling expectation to be flagged;
 * higher sensitivity means a tighter band and more anomalies.
 */
public enum Sensitivity {

    LOW("low", 2.5),
    MEDIUM("medium", 2.0),
    HIGH("high", 1.5);

    private final String code;
    private final double thresholdMultiplier;

    Sensitivity(String code, double thresholdMultiplier) {
        this.code = code;
        this.thresholdMultiplier = thresholdMultiplier;
    }

    @JsonValue
    public String code() { return code; }

    public double thresholdMultiplier() { return thresholdMultiplier; }

    @JsonCreator
    public static Sensitivity fromCode(String code) {
        for (Sensitivity sensitivity : values()) {
            if (sensitivity.code.equals(code)) return sensitivity;
        }
        throw new InvalidArgumentException("AnalyticsConfig",
            "Unrecognized sensitivity '" + code + "' (expected low, medium or high)");
    }
}
