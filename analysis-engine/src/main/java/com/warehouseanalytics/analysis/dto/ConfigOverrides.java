package com.warehouseanalytics.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.warehouseanalytics.common.model.AnalyticsConfig;
import com.warehouseanalytics.common.model.Sensitivity;
import com.warehouseanalytics.common.model.TimeWindow;

/**
 * Partial configuration as sent by the dashboard. Absent fields fall back to
 * the base configuration; present fields are validated when applied.
 */
public record ConfigOverrides(
    @JsonProperty("timeWindow") String timeWindow,
    @JsonProperty("sensitivity") String sensitivity,
    @JsonProperty("enableForecasting") Boolean enableForecasting,
    @JsonProperty("enableAnomalyDetection") Boolean enableAnomalyDetection,
    @JsonProperty("enablePatternRecognition") Boolean enablePatternRecognition,
    @JsonProperty("forecastPeriods") Integer forecastPeriods
) {
    public static ConfigOverrides none() {
        return new ConfigOverrides(null, null, null, null, null, null);
    }

    public AnalyticsConfig applyTo(AnalyticsConfig base) {
        return new AnalyticsConfig(
            timeWindow != null ? TimeWindow.fromCode(timeWindow) : base.timeWindow(),
            sensitivity != null ? Sensitivity.fromCode(sensitivity) : base.sensitivity(),
            enableForecasting != null ? enableForecasting : base.enableForecasting(),
            enableAnomalyDetection != null ? enableAnomalyDetection : base.enableAnomalyDetection(),
            enablePatternRecognition != null ? enablePatternRecognition : base.enablePatternRecognition(),
            forecastPeriods != null ? forecastPeriods : base.forecastPeriods()
        );
    }
}
