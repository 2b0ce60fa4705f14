package com.warehouseanalytics.common.anomaly;

import com.warehouseanalytics.common.model.Anomaly;
import com.warehouseanalytics.common.model.AnomalySeverity;
import com.warehouseanalytics.common.model.AnomalyType;
import com.warehouseanalytics.common.model.Observation;
import com.warehouseanalytics.common.model.Sensitivity;
import com.warehouseanalytics.common.stats.StatisticsPrimitives;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Pure stateless detector that flags observations straying too far from their
 * rolling expectation.
 *
 * <h3>Detection model</h3>
 * <ol>
 *   <li>Expected value at index {@code i} = causal 7-point moving average.</li>
 *   <li>Threshold = {@link Sensitivity#thresholdMultiplier()} × population stdDev of the window.</li>
 *   <li>The first 7 indices are skipped (not enough rolling context).</li>
 *   <li>A point is anomalous when {@code |value - expected| > threshold}.</li>
 * </ol>
 *
 * <h3>Severity ladder</h3>
 * <pre>
 * critical: deviation &gt; 2.0 × threshold
 * high:     deviation &gt; 1.5 × threshold
 * medium:   deviation &gt; 1.2 × threshold
 * low:      otherwise
 * </pre>
 *
 * <p>Each qualifying index yields exactly one {@link Anomaly}; adjacent anomalies
 * are not merged. Windows shorter than {@value #MIN_POINTS} points yield an empty list.
 */
public final class AnomalyDetector {

    /** Minimum window size that supports detection. */
    static final int MIN_POINTS = 10;

    /** Rolling expectation width. Fixed. */
    static final int MOVING_AVERAGE_WINDOW = 7;

    /** Leading indices without enough rolling context. Fixed. */
    static final int WARMUP_POINTS = 7;

    private static final double CRITICAL_FACTOR = 2.0;
    private static final double HIGH_FACTOR     = 1.5;
    private static final double MEDIUM_FACTOR   = 1.2;

    private static final double MAX_CONFIDENCE = 95.0;

    private AnomalyDetector() {}

    /**
     * @param observations window, oldest-first
     * @param sensitivity  threshold level
     * @return flagged anomalies in window order; empty if fewer than {@value #MIN_POINTS} points
     */
    public static List<Anomaly> detect(List<Observation> observations, Sensitivity sensitivity) {
        if (observations == null || observations.size() < MIN_POINTS) {
            return List.of();
        }

        List<Double> values = observations.stream().map(Observation::value).toList();
        List<Double> movingAvg = StatisticsPrimitives.movingAverage(values, MOVING_AVERAGE_WINDOW);
        double stdDev = StatisticsPrimitives.standardDeviation(values);
        double threshold = sensitivity.thresholdMultiplier() * stdDev;

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = WARMUP_POINTS; i < observations.size(); i++) {
            Observation point = observations.get(i);
            double expected = movingAvg.get(i);
            double deviation = Math.abs(point.value() - expected);
            if (deviation <= threshold) continue;

            AnomalyType type = point.value() > expected ? AnomalyType.SPIKE : AnomalyType.DROP;
            AnomalySeverity severity = classifySeverity(deviation, threshold);
            anomalies.add(new Anomaly(
                "anomaly-" + i,
                point.timestamp(),
                point.value(),
                expected,
                severity,
                type,
                describe(type, point.value(), expected),
                computeConfidence(deviation, threshold),
                impactOf(severity)
            ));
        }
        return anomalies;
    }

    // ── Scoring ────────────────────────────────────────────────────

    static AnomalySeverity classifySeverity(double deviation, double threshold) {
        if (deviation > threshold * CRITICAL_FACTOR) return AnomalySeverity.CRITICAL;
        if (deviation > threshold * HIGH_FACTOR)     return AnomalySeverity.HIGH;
        if (deviation > threshold * MEDIUM_FACTOR)   return AnomalySeverity.MEDIUM;
        return AnomalySeverity.LOW;
    }

    static double computeConfidence(double deviation, double threshold) {
        if (threshold == 0) return MAX_CONFIDENCE;
        return Math.min(MAX_CONFIDENCE, (deviation / threshold) * 50);
    }

    // ── Helpers ────────────────────────────────────────────────────

    private static String describe(AnomalyType type, double value, double expected) {
        String label = type == AnomalyType.SPIKE ? "Unusual spike" : "Unusual drop";
        if (expected == 0) {
            return label + " detected (undefined deviation from zero baseline)";
        }
        double deviationPct = (value - expected) / expected * 100;
        return String.format(Locale.ROOT, "%s detected (%+.1f%% deviation)", label, deviationPct);
    }

    private static String impactOf(AnomalySeverity severity) {
        return switch (severity) {
            case CRITICAL -> "High impact on operations";
            case HIGH     -> "Moderate impact expected";
            default       -> "Low impact";
        };
    }
}
