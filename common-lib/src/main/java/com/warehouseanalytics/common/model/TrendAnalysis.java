package com.warehouseanalytics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Directional classification of a window.
 *
 * <p>{@code confidence} is 0 only for the degenerate under-two-points case,
 * otherwise it lies in [50, 95].
 */
public record TrendAnalysis(
    @JsonProperty("direction") TrendDirection direction,
    @JsonProperty("strength") TrendStrength strength,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("changePercent") double changePercent,
    @JsonProperty("description") String description
) {
    public static TrendAnalysis insufficientData() {
        return new TrendAnalysis(TrendDirection.STABLE, TrendStrength.WEAK, 0.0, 0.0,
            "Insufficient data for trend analysis");
    }

    public static TrendAnalysis noData() {
        return new TrendAnalysis(TrendDirection.STABLE, TrendStrength.WEAK, 0.0, 0.0, "No data");
    }
}
