package com.warehouseanalytics.common.engine;

import com.warehouseanalytics.common.anomaly.AnomalyDetector;
import com.warehouseanalytics.common.forecast.Forecaster;
import com.warehouseanalytics.common.forecast.NoiseSource;
import com.warehouseanalytics.common.insight.InsightGenerator;
import com.warehouseanalytics.common.insight.InsightSink;
import com.warehouseanalytics.common.model.AnalyticsConfig;
import com.warehouseanalytics.common.model.AnalyticsResult;
import com.warehouseanalytics.common.model.Anomaly;
import com.warehouseanalytics.common.model.Insight;
import com.warehouseanalytics.common.model.Observation;
import com.warehouseanalytics.common.model.TimeWindow;
import com.warehouseanalytics.common.model.TrendAnalysis;
import com.warehouseanalytics.common.model.WindowMetrics;
import com.warehouseanalytics.common.stats.StatisticsPrimitives;
import com.warehouseanalytics.common.trend.TrendDetector;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry point of the analytics engine. Selects the configured time window and
 * runs trend detection, anomaly detection, forecasting and insight generation
 * over it.
 *
 * <p>Holds only a {@link Clock} (the meaning of "now") and a factory for noise
 * sources, both immutable, so a single instance can be shared across threads.
 * Each call obtains a fresh {@link NoiseSource}; with a seeded factory, repeated
 * calls on the same input return identical forecasts.
 *
 * <p>No I/O. No logging. The optional {@link InsightSink} is the only side effect.
 */
public class AnalyticsEngine {

    private final Clock clock;
    private final Supplier<NoiseSource> noiseFactory;

    public AnalyticsEngine(Clock clock, Supplier<NoiseSource> noiseFactory) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.noiseFactory = Objects.requireNonNull(noiseFactory, "noiseFactory");
    }

    public static AnalyticsEngine systemDefault() {
        return new AnalyticsEngine(Clock.systemUTC(), NoiseSource::random);
    }

    public AnalyticsResult analyze(List<Observation> observations, AnalyticsConfig config) {
        return analyze(observations, config, InsightSink.noop());
    }

    /**
     * Runs the full analysis against this engine's clock.
     *
     * @param observations time-ascending observations; entries outside the configured window are ignored
     * @param config       validated configuration
     * @param sink         receives each insight, in order, after the result is assembled
     * @return the result bundle; the zero-valued bundle if the window is empty
     */
    public AnalyticsResult analyze(List<Observation> observations, AnalyticsConfig config, InsightSink sink) {
        return analyze(observations, config, sink, clock.instant());
    }

    /**
     * Runs the full analysis with {@code now} as the window end and insight timestamp.
     * Callers that also call {@link #selectWindow(List, TimeWindow, Instant)} pass the
     * same instant to both so the window matches the result.
     */
    public AnalyticsResult analyze(List<Observation> observations, AnalyticsConfig config, InsightSink sink,
                                   Instant now) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(now, "now");

        List<Observation> window = selectWindow(observations, config.timeWindow(), now);
        if (window.isEmpty()) {
            return AnalyticsResult.empty();
        }

        List<Double> values = window.stream().map(Observation::value).toList();

        TrendAnalysis trend = TrendDetector.detect(values);

        List<Anomaly> anomalies = config.enableAnomalyDetection()
            ? AnomalyDetector.detect(window, config.sensitivity())
            : List.of();

        List<Observation> forecast = config.enableForecasting()
            ? Forecaster.forecast(window, config.forecastPeriods(), noiseFactory.get())
            : List.of();

        List<Insight> insights = InsightGenerator.generate(window, anomalies, trend, config, now);

        AnalyticsResult result = new AnalyticsResult(trend, anomalies, forecast, insights, computeMetrics(values));
        insights.forEach(sink::onInsight);
        return result;
    }

    /**
     * Observations with {@code now - window <= timestamp <= now}, relative to this engine's clock.
     */
    public List<Observation> selectWindow(List<Observation> observations, TimeWindow timeWindow) {
        return selectWindow(observations, timeWindow, clock.instant());
    }

    /**
     * Observations with {@code now - window <= timestamp <= now}. Null entries and
     * entries without a timestamp are dropped.
     */
    public List<Observation> selectWindow(List<Observation> observations, TimeWindow timeWindow, Instant now) {
        if (observations == null || observations.isEmpty()) return List.of();
        Instant cutoff = now.minus(timeWindow.span());
        return observations.stream()
            .filter(Objects::nonNull)
            .filter(o -> o.timestamp() != null)
            .filter(o -> !o.timestamp().isBefore(cutoff) && !o.timestamp().isAfter(now))
            .toList();
    }

    // ── Helpers ────────────────────────────────────────────────────

    static WindowMetrics computeMetrics(List<Double> values) {
        double total = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            total += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return new WindowMetrics(values.size(), total, total / values.size(), min, max,
            StatisticsPrimitives.standardDeviation(values));
    }
}
