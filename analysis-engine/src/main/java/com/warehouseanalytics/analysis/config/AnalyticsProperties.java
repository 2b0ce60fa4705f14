package com.warehouseanalytics.analysis.config;

import com.warehouseanalytics.analysis.dto.ConfigOverrides;
import com.warehouseanalytics.common.model.AnalyticsConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code analytics.*} settings.
 *
 * <pre>
 * analytics:
 *   defaults:          # applied to every request field the caller leaves out
 *     time-window: 30d
 *     sensitivity: medium
 *     forecast-periods: 7
 *   forecast:
 *     seed: 42         # optional; makes forecast noise reproducible
 * </pre>
 */
@ConfigurationProperties(prefix = "analytics")
public record AnalyticsProperties(Defaults defaults, Forecast forecast) {

    public AnalyticsProperties {
        if (defaults == null) {
            defaults = new Defaults(null, null, null, null, null, null);
        }
        if (forecast == null) {
            forecast = new Forecast(null);
        }
    }

    public record Defaults(
        String timeWindow,
        String sensitivity,
        Boolean enableForecasting,
        Boolean enableAnomalyDetection,
        Boolean enablePatternRecognition,
        Integer forecastPeriods
    ) {
        /** Built-in defaults overlaid with whatever is configured; invalid values fail startup. */
        public AnalyticsConfig toConfig() {
            return new ConfigOverrides(timeWindow, sensitivity, enableForecasting,
                enableAnomalyDetection, enablePatternRecognition, forecastPeriods)
                .applyTo(AnalyticsConfig.defaults());
        }
    }

    public record Forecast(Long seed) {
        public boolean seeded() {
            return seed != null;
        }
    }
}
