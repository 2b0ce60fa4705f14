package com.warehouseanalytics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.warehouseanalytics.common.exception.InvalidArgumentException;

/**
 * Per-invocation engine configuration. Validated on construction, so an
 * instance that exists is always usable.
 *
 * @param timeWindow               look-back span applied before any analysis
 * @param sensitivity              anomaly threshold level
 * @param enableForecasting        run the forecaster
 * @param enableAnomalyDetection   run the anomaly detector
 * @param enablePatternRecognition emit the recent-pattern insight
 * @param forecastPeriods          forecast horizon in days, 1 to 30
 */
public record AnalyticsConfig(
    @JsonProperty("timeWindow") TimeWindow timeWindow,
    @JsonProperty("sensitivity") Sensitivity sensitivity,
    @JsonProperty("enableForecasting") boolean enableForecasting,
    @JsonProperty("enableAnomalyDetection") boolean enableAnomalyDetection,
    @JsonProperty("enablePatternRecognition") boolean enablePatternRecognition,
    @JsonProperty("forecastPeriods") int forecastPeriods
) {
    public static final int MIN_FORECAST_PERIODS = 1;
    public static final int MAX_FORECAST_PERIODS = 30;

    public AnalyticsConfig {
        if (timeWindow == null) {
            throw new InvalidArgumentException("AnalyticsConfig", "timeWindow must be provided");
        }
        if (sensitivity == null) {
            throw new InvalidArgumentException("AnalyticsConfig", "sensitivity must be provided");
        }
        if (forecastPeriods < MIN_FORECAST_PERIODS || forecastPeriods > MAX_FORECAST_PERIODS) {
            throw new InvalidArgumentException("AnalyticsConfig",
                "forecastPeriods must be between " + MIN_FORECAST_PERIODS + " and "
                    + MAX_FORECAST_PERIODS + " but was " + forecastPeriods);
        }
    }

    public static AnalyticsConfig defaults() {
        return new AnalyticsConfig(TimeWindow.THIRTY_DAYS, Sensitivity.MEDIUM, true, true, true, 7);
    }

    public AnalyticsConfig withTimeWindow(TimeWindow window) {
        return new AnalyticsConfig(window, sensitivity, enableForecasting,
            enableAnomalyDetection, enablePatternRecognition, forecastPeriods);
    }

    public AnalyticsConfig withSensitivity(Sensitivity level) {
        return new AnalyticsConfig(timeWindow, level, enableForecasting,
            enableAnomalyDetection, enablePatternRecognition, forecastPeriods);
    }

    public AnalyticsConfig withForecastPeriods(int periods) {
        return new AnalyticsConfig(timeWindow, sensitivity, enableForecasting,
            enableAnomalyDetection, enablePatternRecognition, periods);
    }
}
