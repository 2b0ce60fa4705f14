package com.warehouseanalytics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AnalyticsResult(
    @JsonProperty("trend") TrendAnalysis trend,
    @JsonProperty("anomalies") List<Anomaly> anomalies,
    @JsonProperty("forecast") List<Observation> forecast,
    @JsonProperty("insights") List<Insight> insights,
    @JsonProperty("metrics") WindowMetrics metrics
) {
    /** Zero-valued bundle returned when the observation window is empty. */
    public static AnalyticsResult empty() {
        return new AnalyticsResult(TrendAnalysis.noData(), List.of(), List.of(), List.of(),
            WindowMetrics.empty());
    }
}
